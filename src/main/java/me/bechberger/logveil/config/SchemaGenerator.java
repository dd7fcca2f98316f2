package me.bechberger.logveil.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfig;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;

/**
 * Generates the JSON Schema of the profile file format.
 * Editors can use it for validation and completion of profile YAML files.
 */
public class SchemaGenerator {

    private SchemaGenerator() {
    }

    /**
     * Generate JSON Schema for ProfileConfig
     */
    public static JsonNode generateSchema() {
        JacksonModule module = new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED);
        SchemaGeneratorConfigBuilder configBuilder = new SchemaGeneratorConfigBuilder(
                SchemaVersion.DRAFT_2020_12,
                OptionPreset.PLAIN_JSON)
            .with(module)
            .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT)
            .with(Option.VALUES_FROM_CONSTANT_FIELDS);

        SchemaGeneratorConfig config = configBuilder.build();
        com.github.victools.jsonschema.generator.SchemaGenerator generator =
            new com.github.victools.jsonschema.generator.SchemaGenerator(config);

        return generator.generateSchema(ProfileConfig.class);
    }
}
