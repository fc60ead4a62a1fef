package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.expr.SimpleExpressionEvaluator;
import com.ciro.jwebtemplate.json.ObjectMapperFactory;
import com.ciro.jwebtemplate.spi.ExpressionEvaluator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/** Settings shared by every render of one {@link WebTemplateRenderer}. */
public final class RendererOptions {

    public static final String DEFAULT_SKELETON = "skeleton.html";

    private final String defaultSkeleton;
    private final boolean debugComments;
    private final ObjectMapper objectMapper;
    private final ExpressionEvaluator evaluator;

    private RendererOptions(Builder b) {
        this.defaultSkeleton = b.defaultSkeleton;
        this.debugComments = b.debugComments;
        this.objectMapper = b.objectMapper != null ? b.objectMapper : ObjectMapperFactory.create();
        this.evaluator = b.evaluator != null ? b.evaluator : new SimpleExpressionEvaluator();
    }

    public static RendererOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDefaultSkeleton() { return defaultSkeleton; }
    public boolean isDebugComments() { return debugComments; }
    public ObjectMapper getObjectMapper() { return objectMapper; }
    public ExpressionEvaluator getEvaluator() { return evaluator; }

    public static final class Builder {
        private String defaultSkeleton = DEFAULT_SKELETON;
        private boolean debugComments;
        private ObjectMapper objectMapper;
        private ExpressionEvaluator evaluator;

        private Builder() {}

        public Builder defaultSkeleton(String name) {
            this.defaultSkeleton = Objects.requireNonNull(name, "defaultSkeleton");
            return this;
        }

        /** Brackets partials and the composed document with HTML comments naming their source. */
        public Builder debugComments(boolean enabled) {
            this.debugComments = enabled;
            return this;
        }

        /** Parses {@code render-template} data and writes structured values into text, attributes and scripts. */
        public Builder objectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public Builder evaluator(ExpressionEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public RendererOptions build() {
            return new RendererOptions(this);
        }
    }
}
