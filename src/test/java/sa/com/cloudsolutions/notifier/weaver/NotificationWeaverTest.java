package sa.com.cloudsolutions.notifier.weaver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.util.CheckClassAdapter;
import sa.com.cloudsolutions.notifier.fixtures.BaseModel;
import sa.com.cloudsolutions.notifier.fixtures.DerivedModel;
import sa.com.cloudsolutions.notifier.fixtures.ExplicitOrder;
import sa.com.cloudsolutions.notifier.fixtures.ImplicitPerson;
import sa.com.cloudsolutions.notifier.fixtures.IntermediateModel;
import sa.com.cloudsolutions.notifier.fixtures.MissingTarget;
import sa.com.cloudsolutions.notifier.fixtures.Outer;
import sa.com.cloudsolutions.notifier.fixtures.QuietNotifier;
import sa.com.cloudsolutions.notifier.model.ModuleImage;
import sa.com.cloudsolutions.notifier.model.TypeModel;

import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.jar.JarFile;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.bytesOf;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.call;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.directoryModule;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.entryName;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.isolatedLoader;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.jarModule;
import static sa.com.cloudsolutions.notifier.util.ClassFileHelper.newInstance;

class NotificationWeaverTest {

    @TempDir
    Path temp;

    private static byte[] readEntry(Path jar, Class<?> type) throws Exception {
        try (JarFile file = new JarFile(jar.toFile()); InputStream in = file.getInputStream(file.getEntry(entryName(type)))) {
            return in.readAllBytes();
        }
    }

    private static Object woven(byte[] classFile, String className) throws Exception {
        return newInstance(isolatedLoader(Map.of(className, classFile)).loadClass(className));
    }

    private static String verify(byte[] classFile) {
        StringWriter problems = new StringWriter();
        CheckClassAdapter.verify(new ClassReader(classFile), NotificationWeaverTest.class.getClassLoader(), false,
                new PrintWriter(problems));
        return problems.toString();
    }

    @Test
    @DisplayName("A module with nothing to weave is not written")
    void unchangedModuleIsNotWritten() throws Exception {
        Path jar = jarModule(temp.resolve("quiet.jar"), QuietNotifier.class, BaseModel.class);
        byte[] before = Files.readAllBytes(jar);

        assertFalse(new NotificationWeaver(jar).insertNotifications());

        assertArrayEquals(before, Files.readAllBytes(jar));
    }

    @Test
    void jarIsRewrittenInPlace() throws Exception {
        Path jar = jarModule(temp.resolve("app.jar"), ImplicitPerson.class, QuietNotifier.class);

        assertTrue(new NotificationWeaver(jar).insertNotifications());

        byte[] person = readEntry(jar, ImplicitPerson.class);
        assertEquals("", verify(person));
        Object instance = woven(person, ImplicitPerson.class.getName());
        call(instance, "setName", "Grace");
        assertEquals(List.of("name"), call(instance, "getNotifications"));

        assertArrayEquals(bytesOf(QuietNotifier.class), readEntry(jar, QuietNotifier.class));
        try (JarFile file = new JarFile(jar.toFile())) {
            assertNotNull(file.getEntry("config/app.properties"));
            assertNotNull(file.getManifest());
        }
    }

    @Test
    void classDirectoryIsRewrittenInPlace() throws Exception {
        Path classes = directoryModule(temp.resolve("classes"), ExplicitOrder.class);
        Path classFile = classes.resolve(entryName(ExplicitOrder.class));

        assertTrue(new NotificationWeaver(classes).insertNotifications());

        byte[] order = Files.readAllBytes(classFile);
        assertEquals("", verify(order));
        Object instance = woven(order, ExplicitOrder.class.getName());
        call(instance, "setCustomer", "ACME");
        assertEquals(List.of("customer"), call(instance, "getChanges"));
    }

    @Test
    @DisplayName("A fatal error leaves the module untouched, even when other classes were already woven")
    void fatalErrorLeavesModuleUntouched() throws Exception {
        Path jar = jarModule(temp.resolve("broken.jar"), ImplicitPerson.class, MissingTarget.class);
        byte[] before = Files.readAllBytes(jar);

        WeavingException e = assertThrows(WeavingException.class, () -> new NotificationWeaver(jar).insertNotifications());

        assertTrue(e.getMessage().contains("MissingTarget"), e.getMessage());
        assertArrayEquals(before, Files.readAllBytes(jar));
    }

    @Test
    @DisplayName("Changes to nested classes alone are enough to write the module")
    void nestedChangesAreWritten() throws Exception {
        Path jar = jarModule(temp.resolve("nested.jar"), Outer.class, Outer.Inner.class, Outer.Inner.Deepest.class);

        assertTrue(new NotificationWeaver(jar).insertNotifications());

        assertArrayEquals(bytesOf(Outer.class), readEntry(jar, Outer.class));
        ModuleImage reloaded = ModuleImage.load(jar, false);
        TypeModel inner = reloaded.find("sa/com/cloudsolutions/notifier/fixtures/Outer$Inner").orElseThrow();
        assertEquals("", verify(readEntry(jar, Outer.Inner.class)));
        assertEquals("", verify(readEntry(jar, Outer.Inner.Deepest.class)));
        assertEquals(1, reloaded.topLevelTypes().size());
        assertEquals(1, inner.nestedTypes().size());
    }

    @Test
    @DisplayName("Weaving twice doubles the notifications")
    void weavingTwiceDoublesCalls() throws Exception {
        Path jar = jarModule(temp.resolve("twice.jar"), ImplicitPerson.class);

        assertTrue(new NotificationWeaver(jar).insertNotifications());
        assertTrue(new NotificationWeaver(jar).insertNotifications());

        Object instance = woven(readEntry(jar, ImplicitPerson.class), ImplicitPerson.class.getName());
        call(instance, "setName", "Linus");
        assertEquals(List.of("name", "name"), call(instance, "getNotifications"));
    }

    @Test
    @DisplayName("A target inherited from a class in another JAR is called")
    void crossModuleTarget() throws Exception {
        Path libraries = Files.createDirectories(temp.resolve("libs"));
        jarModule(libraries.resolve("base.jar"), IntermediateModel.class, BaseModel.class);
        Path app = jarModule(libraries.resolve("app.jar"), DerivedModel.class);

        assertTrue(new NotificationWeaver(app).insertNotifications());

        byte[] derived = readEntry(app, DerivedModel.class);
        Object instance = woven(derived, DerivedModel.class.getName());
        call(instance, "setTitle", "Prof");
        assertEquals(List.of("title"), call(instance, "getFired"));
    }

    @Test
    void debugAttributesAreKeptOnlyInDebugMode() throws Exception {
        Path plain = jarModule(temp.resolve("plain.jar"), ImplicitPerson.class);
        Path debug = jarModule(temp.resolve("debug.jar"), ImplicitPerson.class);

        new NotificationWeaver(plain).insertNotifications();
        new NotificationWeaver(new WeaverOptions(debug, true, List.of())).insertNotifications();

        assertNull(ModuleImage.load(plain, true).find("sa/com/cloudsolutions/notifier/fixtures/ImplicitPerson")
                .orElseThrow().node().sourceFile);
        assertEquals("ImplicitPerson.java", ModuleImage.load(debug, true)
                .find("sa/com/cloudsolutions/notifier/fixtures/ImplicitPerson").orElseThrow().node().sourceFile);
    }
}
