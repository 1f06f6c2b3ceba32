package astgen.targets;

import astgen.ErrorListener;
import astgen.asts.FileGenerator;
import astgen.asts.Formatter;
import astgen.asts.Generator;
import astgen.asts.ast.Family;
import astgen.asts.ast.LoxSchema;
import astgen.asts.ast.NodeDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles the generated Java sources and dispatches through them.
 */
public class JavaBackendCompileTest {

    @TempDir
    Path tempDir;

    @Test
    public void testGenericDispatch() throws Exception {
        ClassLoader loader = generateAndCompile(true);

        // Statement: one generic visitor
        Class<?> visitor = loader.loadClass("lox.Statement$Visitor");
        Class<?> print = loader.loadClass("lox.Statement$PrintStatement");
        Method accept = print.getMethod("accept", visitor);
        assertEquals(1, accept.getTypeParameters().length);

        Object node = newNode(print);
        Recorder recorder = new Recorder();
        assertEquals("visitPrintStatement", accept.invoke(node, recorder.proxy(visitor)));
        assertSame(node, recorder.arguments.get(0));

        // Expression: accept methods per result type, no acceptor classes
        Class<?> binary = loader.loadClass("lox.Expression$BinaryExpression");
        Class<?> stringVisitor = loader.loadClass("lox.Expression$StringVisitor");
        Object binaryNode = newNode(binary);
        assertEquals("visitBinaryExpression",
                binary.getMethod("acceptString", stringVisitor).invoke(binaryNode, recorder.proxy(stringVisitor)));
        assertThrows(ClassNotFoundException.class,
                () -> loader.loadClass("lox.Expression$BinaryExpressionStringAcceptor"));
    }

    @Test
    public void testFixedDispatch() throws Exception {
        ClassLoader loader = generateAndCompile(false);

        Class<?> visitor = loader.loadClass("lox.Statement$Visitor");
        Class<?> block = loader.loadClass("lox.Statement$BlockStatement");
        Method accept = block.getMethod("accept", visitor);
        assertEquals(0, accept.getTypeParameters().length);
        assertEquals(Object.class, accept.getReturnType());
        assertEquals(0, visitor.getTypeParameters().length);

        Object node = newNode(block);
        assertEquals("visitBlockStatement", accept.invoke(node, new Recorder().proxy(visitor)));
    }

    @Test
    public void testAcceptorsDispatchLikeTheVisitor() throws Exception {
        ClassLoader loader = generateAndCompile(false);
        Family family = LoxSchema.EXPRESSION;

        for (String label : new String[]{"String", "Value"}) {
            Class<?> visitor = loader.loadClass("lox.Expression$" + label + "Visitor");
            for (NodeDefinition n : family.nodes) {
                String typeName = n.getTypeName(family);
                Class<?> nodeClass = loader.loadClass("lox.Expression$" + typeName);
                Class<?> acceptor = loader.loadClass("lox.Expression$" + typeName + label + "Acceptor");
                Object node = newNode(nodeClass);

                Recorder direct = new Recorder();
                Method visit = visitor.getMethod("visit" + typeName, nodeClass);
                Object expected = visit.invoke(direct.proxy(visitor), node);

                Recorder viaAcceptor = new Recorder();
                Object acceptorInstance = acceptor.getConstructor(nodeClass).newInstance(node);
                Object actual = acceptor.getMethod("accept", visitor)
                        .invoke(acceptorInstance, viaAcceptor.proxy(visitor));

                assertEquals(expected, actual, typeName);
                assertEquals(direct.methods, viaAcceptor.methods, typeName);
                assertEquals(1, viaAcceptor.arguments.size());
                assertSame(node, viaAcceptor.arguments.get(0));
                // nothing but the node
                assertEquals(1, acceptor.getDeclaredFields().length, typeName);

                Recorder viaNode = new Recorder();
                Object result = nodeClass.getMethod("accept" + label, visitor).invoke(node, viaNode.proxy(visitor));
                assertEquals(expected, result);
                assertSame(node, viaNode.arguments.get(0));
            }
        }
    }

    private ClassLoader generateAndCompile(boolean genericMethods) throws Exception {
        Path sources = tempDir.resolve("src");
        Path classes = tempDir.resolve("classes");
        Files.createDirectories(classes);

        FileGenerator fileGenerator = new FileGenerator();
        ErrorListener errorListener = new ErrorListener();
        Generator generator = new Generator(LoxSchema.SCHEMA, fileGenerator, Formatter.disabled(), errorListener);
        generator.generate(new JavaBackend(sources, "lox", genericMethods, LoxSchema.SCHEMA));
        assertEquals(0, errorListener.getErrCount());

        Path token = sources.resolve("lox/Token.java");
        Files.writeString(token, "package lox;\n\npublic final class Token {\n}\n");

        List<String> args = new ArrayList<>();
        args.add("-d");
        args.add(classes.toString());
        args.add(token.toString());
        for (Path p : fileGenerator.getWrittenFiles()) {
            args.add(p.toString());
        }

        var compiler = ToolProvider.getSystemJavaCompiler();
        var errStream = new ByteArrayOutputStream();
        int result = compiler.run(null, null, errStream, args.toArray(new String[0]));
        assertEquals(0, result, "Compilation failed: " + errStream);

        return new URLClassLoader(new URL[]{classes.toUri().toURL()});
    }

    private static Object newNode(Class<?> nodeClass) throws Exception {
        Constructor<?> constructor = nodeClass.getConstructors()[0];
        return constructor.newInstance(new Object[constructor.getParameterCount()]);
    }

    /**
     * Visitor that records the calls it receives and answers with the name of
     * the called method.
     */
    private static class Recorder {
        final List<String> methods = new ArrayList<>();
        final List<Object> arguments = new ArrayList<>();

        Object proxy(Class<?> visitor) {
            return Proxy.newProxyInstance(visitor.getClassLoader(), new Class<?>[]{visitor}, (p, method, args) -> {
                methods.add(method.getName());
                arguments.add(args[0]);
                return method.getName();
            });
        }
    }
}
