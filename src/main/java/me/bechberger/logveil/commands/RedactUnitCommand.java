package me.bechberger.logveil.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.bechberger.logveil.ConfigLoader;
import me.bechberger.logveil.Version;
import me.bechberger.logveil.backend.UnitRequest;
import me.bechberger.logveil.config.ProfileConfig;
import me.bechberger.logveil.engine.Profile;
import me.bechberger.logveil.engine.RedactionEngine;
import me.bechberger.logveil.engine.SanitizedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Redacts a single unit given as JSON on stdin and writes the result as JSON to stdout.
 * This is the protocol of the {@code process} engine, so logveil can serve as its own external engine.
 * A request that carries a {@code profile} is redacted with it instead of the {@code --profile} option.
 */
@Command(
    name = "redact-unit",
    description = {
        "Redact one unit read as JSON from stdin, write the result as JSON to stdout",
        "Request: {\"source\": \"app.log\", \"line\": 1, \"text\": \"...\", \"structured\": \"none|json|yaml|xml\"}",
        "plus an optional \"profile\" object (a resolved profile) that replaces --profile"
    },
    mixinStandardHelpOptions = true,
    version = Version.FULL_VERSION,
    footerHeading = "%nExamples:%n",
    footer = {
        "",
        "  Redact one line:",
        "    echo '{\"source\":\"app.log\",\"line\":1,\"text\":\"mail bob@example.com\"}' | logveil redact-unit",
        "",
        "  Use logveil as the external engine of another logveil:",
        "    logveil redact app.log --engine process --engine-command 'logveil redact-unit'",
        ""
    }
)
public class RedactUnitCommand extends BaseProfileCommand {

    private static final Logger logger = LoggerFactory.getLogger(RedactUnitCommand.class);

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    protected Logger getLogger() {
        return logger;
    }

    @Override
    protected int run() throws IOException {
        String body = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("Expected a JSON request on stdin, got nothing");
        }
        UnitRequest request;
        try {
            request = mapper.readValue(body, UnitRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid request: " + e.getOriginalMessage(), e);
        }

        Profile profile = request.profile() != null ? compileInline(request.profile()) : loadProfile(new ConfigLoader());
        SanitizedResult result = new RedactionEngine(profile).redact(request.toUnit());
        PrintWriter out = spec.commandLine().getOut();
        out.println(mapper.writeValueAsString(result));
        out.flush();
        return 0;
    }

    /**
     * The profile sent with the request is already resolved; command line overrides still apply on top.
     */
    private Profile compileInline(JsonNode tree) throws ConfigLoader.ConfigurationException {
        ProfileConfig config;
        try {
            config = mapper.treeToValue(tree, ProfileConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigLoader.ConfigurationException("Invalid profile in request: " + e.getOriginalMessage(), e);
        }
        config.setParent("none");
        config.applyCliOptions(createCliOptions());
        Profile profile = Profile.compile(config);
        logger.debug("Using profile '{}' from the request", profile.getName());
        return profile;
    }
}
