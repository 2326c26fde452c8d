package dev.modelkit.reflect;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ReflectiveFunctionTest {

    public static class Tokenizer {
        private final String prefix;

        public Tokenizer(String prefix) {
            this.prefix = prefix;
        }

        public String encode(
                String text, @DefaultValue("8") int maxLength, @DefaultValue("false") boolean pad) {
            return "%s%s/%d/%s".formatted(prefix, text, maxLength, pad);
        }

        public static String join(String separator, String... parts) {
            return String.join(separator, parts);
        }

        public static Map<String, Object> collect(
                String name, @KeywordArgs Map<String, Object> extra) {
            return Map.of("name", name, "extra", extra);
        }

        public static void fail(String reason) throws IOException {
            throw new IOException(reason);
        }
    }

    private final Tokenizer tokenizer = new Tokenizer("#");

    @Test
    void bindsPositionalKeywordAndDefaultValues() throws Exception {
        var encode = ReflectiveFunction.bound(tokenizer, "encode");

        assertEquals("#hi/8/false", encode.call(Arguments.of("hi")));
        assertEquals("#hi/3/false", encode.call(Arguments.of("hi", 3)));
        assertEquals("#hi/8/true", encode.call(Arguments.of("hi").with("pad", true)));
        assertEquals(
                "#hi/5/true",
                encode.call(
                        Arguments.ofKeywords(Map.of("text", "hi", "maxLength", 5, "pad", true))));
    }

    @Test
    void rejectsCallsThatDoNotFit() {
        var encode = ReflectiveFunction.bound(tokenizer, "encode");

        var tooMany =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> encode.call(Arguments.of("a", 1, true, "extra")));
        assertTrue(tooMany.getMessage().contains("positional"));

        var unexpected =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> encode.call(Arguments.of("a").with("truncate", true)));
        assertTrue(unexpected.getMessage().contains("truncate"));

        var duplicate =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> encode.call(Arguments.of("a", 4).with("maxLength", 5)));
        assertTrue(duplicate.getMessage().contains("multiple values"));

        var missing =
                assertThrows(IllegalArgumentException.class, () -> encode.call(Arguments.empty()));
        assertTrue(missing.getMessage().contains("text"));
    }

    @Test
    void convertsValuesOfAnotherRuntimeType() throws Exception {
        var encode = ReflectiveFunction.bound(tokenizer, "encode");
        var join = ReflectiveFunction.of(Tokenizer.class, "join");

        assertEquals("#hi/3/false", encode.call(Arguments.of("hi", 3L)));
        assertEquals("#hi/4/false", encode.call(Arguments.of("hi").with("maxLength", 4.0)));
        assertEquals("1-2", join.call(Arguments.of("-", 1, 2)));

        var mismatch =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> encode.call(Arguments.of("hi").with("maxLength", List.of(1))));
        assertTrue(mismatch.getMessage().contains("maxLength"));
    }

    @Test
    void collectsVariadicArguments() throws Exception {
        var join = ReflectiveFunction.of(Tokenizer.class, "join");
        assertEquals("a-b-c", join.call(Arguments.of("-", "a", "b", "c")));
        assertEquals("", join.call(Arguments.of("-")));

        var collect = ReflectiveFunction.of(Tokenizer.class, "collect");
        assertEquals(
                Map.of("name", "n", "extra", Map.of("k", 1)),
                collect.call(Arguments.of("n").with("k", 1)));
    }

    @Test
    void exceptionsFromTheBodyAreNotWrapped() {
        var fail = ReflectiveFunction.of(Tokenizer.class, "fail");

        var thrown = assertThrows(IOException.class, () -> fail.call(Arguments.of("disk full")));
        assertEquals("disk full", thrown.getMessage());
    }

    @Test
    void plainFunctionsAndBoundMethodsAreDistinguished() throws Exception {
        var join = ReflectiveFunction.of(Tokenizer.class, "join");
        var encode = ReflectiveFunction.bound(tokenizer, "encode");

        assertTrue(join.isPlainFunction());
        assertFalse(encode.isPlainFunction());
        assertSame(tokenizer, encode.receiver());
        assertEquals("encode", encode.name());
        assertEquals(Tokenizer.class, encode.origin());
        assertEquals(List.of("text", "maxLength", "pad"), encode.signature().parameterNames());

        Method instanceMethod =
                Tokenizer.class.getMethod("encode", String.class, int.class, boolean.class);
        assertThrows(IllegalArgumentException.class, () -> ReflectiveFunction.of(instanceMethod));
        assertThrows(
                IllegalArgumentException.class,
                () -> ReflectiveFunction.bound("not a tokenizer", instanceMethod));
    }

    @Test
    void findMethodPrefersTheNearestDeclaration() {
        var found = ReflectiveFunction.findMethod(Tokenizer.class, "encode", false).orElseThrow();
        assertEquals(Tokenizer.class, found.getDeclaringClass());
        assertTrue(ReflectiveFunction.findMethod(Tokenizer.class, "encode", true).isEmpty());
        assertTrue(ReflectiveFunction.findMethod(Tokenizer.class, "decode", false).isEmpty());
    }
}
