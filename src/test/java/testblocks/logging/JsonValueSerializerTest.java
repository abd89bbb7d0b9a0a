package testblocks.logging;

import testblocks.config.FrameworkConfig;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class JsonValueSerializerTest {

    public static class Credentials {
        public String user = "admin";
        public int    attempts = 3;
    }

    public static class Empty {}

    public static class Exploding {
        public String getValue() {
            throw new IllegalStateException("getter failed");
        }
    }

    private final JsonValueSerializer serializer = new JsonValueSerializer(false, 0);

    @Test
    public void null_isLiteralNull() {
        assertThat(serializer.serialize(null)).isEqualTo("null");
    }

    @Test(description = "Values are wrapped with their simple class name")
    public void object_isWrappedWithTypeName() {
        String json = serializer.serialize(new Credentials());

        assertThat(json)
                .contains("\"$type\":\"Credentials\"")
                .contains("\"user\":\"admin\"")
                .contains("\"attempts\":3");
    }

    @Test
    public void javaTime_isWrittenAsIsoString() {
        assertThat(serializer.serialize(LocalDate.of(2024, 1, 2))).contains("\"2024-01-02\"");
    }

    @Test
    public void list_isSerialized() {
        assertThat(serializer.serialize(List.of("a", "b"))).contains("[\"a\",\"b\"]");
    }

    @Test
    public void emptyBean_doesNotFail() {
        assertThat(serializer.serialize(new Empty())).contains("\"$type\":\"Empty\"");
    }

    @Test(description = "A value Jackson cannot write yields the fallback text instead of an exception")
    public void unserializable_returnsFallback() {
        assertThat(serializer.serialize(new Exploding())).isEqualTo(ValueSerializer.FALLBACK);
    }

    @Test
    public void longOutput_isTruncated() {
        JsonValueSerializer shortSerializer = new JsonValueSerializer(false, 20);

        String json = shortSerializer.serialize("x".repeat(100));

        assertThat(json).hasSize(20 + "...(truncated)".length()).endsWith("...(truncated)");
    }

    @Test
    public void prettyOutput_isMultiLine() {
        Properties p = new Properties();
        p.setProperty("testblocks.serializer.pretty", "true");

        String json = new JsonValueSerializer(new FrameworkConfig(p)).serialize(new Credentials());

        assertThat(json).contains("\n");
    }
}
