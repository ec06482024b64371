package org.zwolang;

import org.zwolang.peg.parser.ParserConfig;

/**
 * Settings for a {@link ZwomConverter}.
 *
 * @param indent       spaces per nesting level in the rendered document
 * @param sportType    value of the {@code sportType} trailer element
 * @param parserConfig settings of the underlying PEG parser
 */
public record ConverterConfig(int indent, String sportType, ParserConfig parserConfig) {

    public static final ConverterConfig DEFAULT = new ConverterConfig(4, "bike", ParserConfig.DEFAULT);

    public ConverterConfig {
        if (indent < 0) {
            throw new IllegalArgumentException("Indent must be >= 0, received: " + indent);
        }
        if (sportType == null || sportType.isBlank()) {
            throw new IllegalArgumentException("Sport type must not be blank");
        }
        if (parserConfig == null) {
            throw new IllegalArgumentException("Parser config must not be null");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int indent = DEFAULT.indent();
        private String sportType = DEFAULT.sportType();
        private ParserConfig parserConfig = DEFAULT.parserConfig();

        private Builder() {}

        public Builder indent(int indent) {
            this.indent = indent;
            return this;
        }

        public Builder sportType(String sportType) {
            this.sportType = sportType;
            return this;
        }

        public Builder parserConfig(ParserConfig parserConfig) {
            this.parserConfig = parserConfig;
            return this;
        }

        public ConverterConfig build() {
            return new ConverterConfig(indent, sportType, parserConfig);
        }
    }
}
