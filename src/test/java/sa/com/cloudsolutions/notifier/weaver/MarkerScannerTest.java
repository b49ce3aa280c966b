package sa.com.cloudsolutions.notifier.weaver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodNode;
import sa.com.cloudsolutions.notifier.fixtures.AbstractSetter;
import sa.com.cloudsolutions.notifier.fixtures.BaseModel;
import sa.com.cloudsolutions.notifier.fixtures.DerivedModel;
import sa.com.cloudsolutions.notifier.fixtures.ExplicitOrder;
import sa.com.cloudsolutions.notifier.fixtures.ImplicitPerson;
import sa.com.cloudsolutions.notifier.fixtures.IntermediateModel;
import sa.com.cloudsolutions.notifier.fixtures.MissingTarget;
import sa.com.cloudsolutions.notifier.fixtures.Outer;
import sa.com.cloudsolutions.notifier.fixtures.PrivateTargetBase;
import sa.com.cloudsolutions.notifier.fixtures.QuietNotifier;
import sa.com.cloudsolutions.notifier.model.TypeModel;
import sa.com.cloudsolutions.notifier.model.TypeTrees;
import sa.com.cloudsolutions.notifier.model.TypeResolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.objectweb.asm.Opcodes.ALOAD;
import static org.objectweb.asm.Opcodes.ILOAD;
import static org.objectweb.asm.Opcodes.INVOKEVIRTUAL;
import static org.objectweb.asm.Opcodes.LDC;
import static org.objectweb.asm.Opcodes.NOP;
import static org.objectweb.asm.Opcodes.PUTFIELD;
import static org.objectweb.asm.Opcodes.RETURN;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.call;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.isolatedLoader;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.load;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.newInstance;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.typeOf;

class MarkerScannerTest {
    private static final TypeResolver NOTHING = internalName -> Optional.empty();

    private final MarkerScanner scanner = new MarkerScanner(new NotifyTargetResolver(NOTHING));

    private static MethodNode method(TypeModel type, String name) {
        return type.methods().stream().filter(m -> m.name.equals(name)).findFirst().orElseThrow();
    }

    private static List<Object> reportedNames(MethodNode method) {
        List<Object> names = new ArrayList<>();
        for (AbstractInsnNode node : method.instructions) {
            if (node instanceof LdcInsnNode) {
                names.add(((LdcInsnNode) node).cst);
            }
        }
        return names;
    }

    private static List<Integer> opcodes(MethodNode method) {
        List<Integer> opcodes = new ArrayList<>();
        for (AbstractInsnNode node : method.instructions) {
            if (node.getOpcode() >= 0) {
                opcodes.add(node.getOpcode());
            }
        }
        return opcodes;
    }

    @Nested
    @DisplayName("Implicit mode")
    class Implicit {

        @Test
        @DisplayName("A public setter without markers reports its own name")
        void publicSetterGetsDefaultName() {
            TypeModel person = typeOf(ImplicitPerson.class);

            assertTrue(scanner.processType(person));

            MethodNode setName = method(person, "setName");
            assertEquals(Arrays.asList(NOP, ALOAD, ALOAD, PUTFIELD, ALOAD, LDC, INVOKEVIRTUAL, NOP, RETURN),
                    opcodes(setName));
            assertEquals(List.of("name"), reportedNames(setName));
            assertTrue(person.isModified());
        }

        @Test
        void nonPublicAndSuppressedSettersAreLeftAlone() {
            TypeModel person = typeOf(ImplicitPerson.class);
            scanner.processType(person);

            assertEquals(Arrays.asList(ALOAD, ILOAD, PUTFIELD, RETURN), opcodes(method(person, "setAge")));
            assertTrue(reportedNames(method(person, "setNickname")).isEmpty());
        }

        @Test
        void explicitNamesOverrideDefault() {
            TypeModel person = typeOf(ImplicitPerson.class);
            scanner.processType(person);

            assertEquals(List.of("amount", "summary"), reportedNames(method(person, "setAmount")));
        }

        @Test
        void wovenClassNotifiesAtRuntime() throws Exception {
            TypeModel person = typeOf(ImplicitPerson.class);
            scanner.processType(person);
            Object instance = newInstance(load(person));

            call(instance, "setName", "Ada");
            call(instance, "setNickname", "A");
            call(instance, "setAmount", 12L);

            assertEquals(List.of("name", "amount", "summary"), call(instance, "getNotifications"));
            assertEquals("Ada", call(instance, "getName"));
            assertEquals(12L, call(instance, "getAmount"));
        }
    }

    @Nested
    @DisplayName("Explicit mode")
    class Explicit {

        @Test
        void onlyMarkedPropertiesAreWoven() {
            TypeModel order = typeOf(ExplicitOrder.class);

            assertTrue(scanner.processType(order));

            assertEquals(List.of("status"), reportedNames(method(order, "setState")));
            assertEquals(List.of("customer"), reportedNames(method(order, "setCustomer")));
            assertTrue(reportedNames(method(order, "setComment")).isEmpty());
            assertEquals(List.of("channel"), reportedNames(method(order, "setChannel")));
        }

        @Test
        @DisplayName("Suppression wins whatever order the markers are declared in")
        void suppressionWins() {
            TypeModel order = typeOf(ExplicitOrder.class);
            scanner.processType(order);

            assertEquals(Arrays.asList(ALOAD, ALOAD, PUTFIELD, RETURN), opcodes(method(order, "setLocked")));
            assertEquals(Arrays.asList(ALOAD, ALOAD, PUTFIELD, RETURN), opcodes(method(order, "setReference")));
        }

        @Test
        void wovenClassNotifiesAtRuntime() throws Exception {
            TypeModel order = typeOf(ExplicitOrder.class);
            scanner.processType(order);
            Object instance = newInstance(load(order));

            call(instance, "setState", "open");
            call(instance, "setComment", "ignored");
            call(instance, "setTotal", -1.0);
            call(instance, "setTotal", 9.5);
            call(instance, "setArchived", "yes");
            call(instance, "setLocked", "no");
            call(instance, "setReference", "R-1");

            assertEquals(Arrays.asList("status", "total", "tax", "total", null), call(instance, "getChanges"));
            assertEquals(9.5, call(instance, "getTotal"));
        }

        @Test
        @DisplayName("A notifier with no eligible property is left unmodified")
        void noEligibleProperties() {
            TypeModel quiet = typeOf(QuietNotifier.class);

            assertFalse(scanner.processType(quiet));
            assertFalse(quiet.isModified());
        }
    }

    @Nested
    @DisplayName("Nested types")
    class NestedTypes {

        private TypeModel outerWithNested() {
            TypeModel outer = typeOf(Outer.class);
            TypeModel inner = typeOf(Outer.Inner.class);
            TypeModel deepest = typeOf(Outer.Inner.Deepest.class);
            // the module normally builds this tree
            return TypeTrees.nest(outer, TypeTrees.nest(inner, deepest));
        }

        @Test
        @DisplayName("Nested notifiers are woven but do not count for the enclosing type")
        void nestedResultsDoNotBubbleUp() {
            TypeModel outer = outerWithNested();

            assertFalse(scanner.processType(outer));

            assertFalse(outer.isModified());
            TypeModel inner = outer.nestedTypes().get(0);
            TypeModel deepest = inner.nestedTypes().get(0);
            assertTrue(inner.isModified());
            assertTrue(deepest.isModified());
            assertTrue(reportedNames(method(outer, "setIgnored")).isEmpty());
        }

        @Test
        void nestedClassesNotifyAtRuntime() throws Exception {
            TypeModel outer = outerWithNested();
            scanner.processType(outer);
            TypeModel inner = outer.nestedTypes().get(0);
            TypeModel deepest = inner.nestedTypes().get(0);
            ClassLoader loader = isolatedLoader(Map.of(inner.name(), inner.toByteArray(),
                    deepest.name(), deepest.toByteArray()));

            Object deep = newInstance(loader.loadClass(deepest.name()));
            call(deep, "setCode", "c");
            call(deep, "setLevel", 3);

            assertEquals(List.of("code", "deep:level"), call(deep, "getSeen"));
        }
    }

    @Nested
    @DisplayName("Inheritance")
    class Inheritance {

        @Test
        void inheritedTargetIsCalled() throws Exception {
            TypeResolver types = internalName -> Optional.of(internalName)
                    .filter(n -> n.endsWith("IntermediateModel") || n.endsWith("BaseModel"))
                    .map(n -> n.endsWith("IntermediateModel") ? typeOf(IntermediateModel.class) : typeOf(BaseModel.class));
            TypeModel derived = typeOf(DerivedModel.class);

            assertTrue(new MarkerScanner(new NotifyTargetResolver(types)).processType(derived));

            Object instance = newInstance(load(derived));
            call(instance, "setTitle", "Dr");
            assertEquals(List.of("title"), call(instance, "getFired"));
        }

        @Test
        void nestmateCallsPrivateTargetOfItsBase() throws Exception {
            TypeModel base = typeOf(PrivateTargetBase.class);
            TypeResolver types = internalName -> Optional.of(base).filter(b -> b.internalName().equals(internalName));
            TypeModel derived = typeOf(PrivateTargetBase.Derived.class);

            assertTrue(new MarkerScanner(new NotifyTargetResolver(types)).processType(derived));

            Object instance = newInstance(load(derived, base));
            call(instance, "setValue", "x");
            assertEquals(List.of("value"), call(instance, "getChanges"));
        }
    }

    @Nested
    @DisplayName("Fatal conditions")
    class Fatal {

        @Test
        void missingTargetNamesTheType() {
            WeavingException e = assertThrows(WeavingException.class,
                    () -> scanner.processType(typeOf(MissingTarget.class)));
            assertEquals("Cannot locate notify target for type: sa.com.cloudsolutions.notifier.fixtures.MissingTarget",
                    e.getMessage());
        }

        @Test
        void abstractSetterIsFatal() {
            WeavingException e = assertThrows(WeavingException.class,
                    () -> scanner.processType(typeOf(AbstractSetter.class)));
            assertTrue(e.getMessage().contains("AbstractSetter.value"), e.getMessage());
        }
    }
}
