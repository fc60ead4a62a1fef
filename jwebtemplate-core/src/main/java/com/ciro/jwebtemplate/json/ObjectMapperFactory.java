package com.ciro.jwebtemplate.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class ObjectMapperFactory {

    private ObjectMapperFactory() {}

    public static ObjectMapper create() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .addModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();
    }

    /**
     * Writer whose output can be pasted inside a {@code <script>} body: markup-significant
     * characters and JS line terminators come out as {@code \\uXXXX} escapes.
     */
    public static ObjectWriter scriptSafeWriter(ObjectMapper mapper) {
        return mapper.writer().with(new ScriptCharacterEscapes());
    }
}
