package sa.com.cloudsolutions.notifier.weaver;

import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.util.Textifier;
import org.objectweb.asm.util.TraceMethodVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.objectweb.asm.Opcodes.ACONST_NULL;
import static org.objectweb.asm.Opcodes.ALOAD;
import static org.objectweb.asm.Opcodes.NOP;
import static org.objectweb.asm.Opcodes.POP;
import static org.objectweb.asm.Opcodes.POP2;

/**
 * Injects notify target calls into a setter body, in place.
 *
 * <pre>
 *   nop
 *   ...original body up to the final return...
 *   aload 0; ldc "name1" (or aconst_null); invoke target; [pop]; nop
 *   ...one block per name...
 *   return
 * </pre>
 *
 * Blocks go right before the last real instruction of the method, after any label, line number or frame node
 * that precedes it, so every path reaching the final return runs them. Earlier returns are left alone.
 * Running the rewriter twice on the same setter injects the blocks twice.
 */
public class SetterRewriter {
    private static final Logger logger = LoggerFactory.getLogger(SetterRewriter.class);

    /**
     * @param setter an instance method with a body
     * @param names  at least one name; {@code null} elements are passed as {@code null}
     */
    public void rewrite(MethodNode setter, ResolvedNotifyTarget target, List<String> names) {
        InsnList instructions = setter.instructions;
        if (instructions.size() == 0) {
            throw new IllegalArgumentException("Setter " + setter.name + " has no instructions");
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("No property names to report for " + setter.name);
        }

        instructions.insertBefore(instructions.getFirst(), new InsnNode(NOP));

        for (String name : names) {
            instructions.insertBefore(lastInstruction(instructions), notification(target, name));
        }

        if (logger.isTraceEnabled()) {
            logger.trace("Rewrote {}{}:\n{}", setter.name, setter.desc, listing(setter));
        }
    }

    private static InsnList notification(ResolvedNotifyTarget target, String name) {
        InsnList block = new InsnList();
        block.add(new VarInsnNode(ALOAD, 0));
        block.add(name == null ? new InsnNode(ACONST_NULL) : new LdcInsnNode(name));
        block.add(target.newInvocation());
        Type returnType = target.returnType();
        if (returnType.getSort() != Type.VOID) {
            block.add(new InsnNode(returnType.getSize() == 2 ? POP2 : POP));
        }
        block.add(new InsnNode(NOP));
        return block;
    }

    /**
     * The last node that is an actual bytecode instruction. Labels, line numbers and frames report opcode -1.
     */
    static AbstractInsnNode lastInstruction(InsnList instructions) {
        AbstractInsnNode node = instructions.getLast();
        while (node != null && node.getOpcode() < 0) {
            node = node.getPrevious();
        }
        if (node == null) {
            throw new IllegalArgumentException("Method body contains no instructions");
        }
        return node;
    }

    static String listing(MethodNode method) {
        Textifier textifier = new Textifier();
        method.instructions.accept(new TraceMethodVisitor(textifier));
        StringWriter out = new StringWriter();
        textifier.print(new PrintWriter(out));
        return out.toString();
    }
}
