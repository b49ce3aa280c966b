package sa.com.cloudsolutions.notifier.weaver;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import sa.com.cloudsolutions.notifier.model.TypeModel;

/**
 * A validated notify target, as a symbolic method reference that a woven class can invoke.
 */
public final class ResolvedNotifyTarget {
    private final String owner;
    private final String name;
    private final String descriptor;
    private final int access;
    private final boolean ownerIsInterface;
    private final String ownerNestHost;
    private final String callerName;

    private ResolvedNotifyTarget(String owner, String name, String descriptor, int access,
                                 boolean ownerIsInterface, String ownerNestHost, String callerName) {
        this.owner = owner;
        this.name = name;
        this.descriptor = descriptor;
        this.access = access;
        this.ownerIsInterface = ownerIsInterface;
        this.ownerNestHost = ownerNestHost;
        this.callerName = callerName;
    }

    /**
     * A target called from the class that declares it.
     */
    static ResolvedNotifyTarget declaredBy(TypeModel declaringType, MethodNode method) {
        return new ResolvedNotifyTarget(declaringType.internalName(), method.name, method.desc, method.access,
                declaringType.isInterface(), declaringType.nestHost(), declaringType.internalName());
    }

    /**
     * Returns this target as seen from {@code caller}, a subclass of the declaring type that may live in another
     * module. The reference keeps the declaring class as owner. A private target is accessible only to nestmates
     * of the declaring class.
     *
     * @throws WeavingException if the target is not accessible from {@code caller}
     */
    ResolvedNotifyTarget importInto(TypeModel caller) {
        if (caller.internalName().equals(callerName)) {
            return this;
        }
        if ((access & Opcodes.ACC_PRIVATE) != 0 && !ownerNestHost.equals(caller.nestHost())) {
            throw new WeavingException("Notify target " + qualifiedName() + " is private and cannot be called from "
                    + caller.name() + ", which is not a nestmate of " + Type.getObjectType(owner).getClassName());
        }
        if ((access & (Opcodes.ACC_PUBLIC | Opcodes.ACC_PROTECTED)) == 0
                && !packageOf(owner).equals(packageOf(caller.internalName()))) {
            throw new WeavingException("Notify target " + qualifiedName() + " is package-private and cannot be called from "
                    + caller.name());
        }
        return new ResolvedNotifyTarget(owner, name, descriptor, access, ownerIsInterface, ownerNestHost,
                caller.internalName());
    }

    private static String packageOf(String internalName) {
        int slash = internalName.lastIndexOf('/');
        return slash < 0 ? "" : internalName.substring(0, slash);
    }

    public String owner() {
        return owner;
    }

    public String name() {
        return name;
    }

    public String descriptor() {
        return descriptor;
    }

    public Type returnType() {
        return Type.getReturnType(descriptor);
    }

    /**
     * True when the target is declared on an ancestor of the class it is called from.
     */
    public boolean isInherited() {
        return !owner.equals(callerName);
    }

    public String qualifiedName() {
        return Type.getObjectType(owner).getClassName() + "." + name;
    }

    /**
     * A fresh invoke instruction for this target. Private local targets are invoked non-virtually; a private
     * target inherited from a nestmate goes through {@code invokevirtual}, as javac emits for nestmate calls.
     */
    MethodInsnNode newInvocation() {
        int opcode;
        if ((access & Opcodes.ACC_PRIVATE) != 0 && !isInherited()) {
            opcode = Opcodes.INVOKESPECIAL;
        } else if (ownerIsInterface) {
            opcode = Opcodes.INVOKEINTERFACE;
        } else {
            opcode = Opcodes.INVOKEVIRTUAL;
        }
        return new MethodInsnNode(opcode, owner, name, descriptor, ownerIsInterface);
    }

    @Override
    public String toString() {
        return qualifiedName() + descriptor + (isInherited() ? " (inherited)" : "");
    }
}
