package testblocks.logging;

import testblocks.config.FrameworkConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson-backed {@link ValueSerializer}.
 *
 * <p>Objects are written as JSON wrapped with their class name, e.g.
 * {@code {"$type":"Credentials","value":{"user":"admin"}}}, so the log shows
 * which type a block actually received. Output longer than the configured
 * maximum is truncated.
 */
public class JsonValueSerializer implements ValueSerializer {

    private static final Logger log = LoggerFactory.getLogger(JsonValueSerializer.class);

    private static final String TRUNCATED = "...(truncated)";

    private final ObjectWriter writer;
    private final int          maxLength;

    public JsonValueSerializer(FrameworkConfig config) {
        this(config.isSerializerPretty(), config.getSerializerMaxLength());
    }

    public JsonValueSerializer(boolean pretty, int maxLength) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.writer    = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        this.maxLength = maxLength;
    }

    @Override
    public String serialize(Object value) {
        if (value == null) {
            return "null";
        }
        String json;
        try {
            json = writer.writeValueAsString(new TypedValue(value));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not serialize {} for logging: {}", value.getClass().getName(), e.getMessage());
            return FALLBACK;
        }
        if (maxLength > 0 && json.length() > maxLength) {
            return json.substring(0, maxLength) + TRUNCATED;
        }
        return json;
    }

    /** Envelope carrying the simple class name next to the value. */
    static final class TypedValue {
        public final String $type;
        public final Object value;

        TypedValue(Object value) {
            this.$type = value.getClass().getSimpleName();
            this.value = value;
        }
    }
}
