package com.fhi.fixture_isolation.copy;

import java.io.IOException;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Deep copy through a JSON round trip.
 *
 * <p>Suits fixtures that are plain data beans. The value is written and read back as its
 * runtime class, through its fields (getters are ignored so computed properties do not get in
 * the way). Limits of the approach: no cycles, and values held in fields typed
 * {@code Object} come back as maps or lists.</p>
 *
 * <p>Selected with {@code fixture.isolation.copier=jackson}.</p>
 */
public class JacksonFixtureCopier implements FixtureCopier
{
    private final ObjectMapper objectMapper;

    public JacksonFixtureCopier()
    {   this(defaultObjectMapper());
    }

    public JacksonFixtureCopier(ObjectMapper objectMapper)
    {   this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Field-based mapper with java.time support.
     */
    public static ObjectMapper defaultObjectMapper()
    {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)              // ISO strings
                .enable(SerializationFeature.WRITE_DATES_WITH_ZONE_ID)                // ZonedDateTime keeps its zone id
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .registerModule(new JavaTimeModule())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T copy(T value)
    {
        if (value == null) return null;
        try
        {   byte[] json = objectMapper.writeValueAsBytes(value);
            return (T) objectMapper.readValue(json, value.getClass());
        }
        catch (IOException e)
        {   throw new FixtureCopyException(value.getClass(), "JSON round trip failed", e);
        }
    }
}
