package com.compid.cli;

import com.compid.core.id.IdentifierCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to parse a component identifier into its attributes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * compid decompose "ARM::CMSIS Driver:USART@2.1.0"
 * compid decompose "ARM::CMSIS Driver:USART@2.1.0" --json
 * }</pre>
 */
@Command(
    name = "decompose",
    description = "Parse a component identifier into attributes",
    mixinStandardHelpOptions = true
)
public class DecomposeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DecomposeCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(index = "0", description = "Component identifier")
    private String componentId;

    @Option(names = "--json", description = "Print the attributes as a JSON object")
    private boolean json;

    @Override
    public Integer call() {
        Map<String, String> attributes = IdentifierCodec.attributesFromId(componentId);
        log.debug("Decomposed {} into {} attributes", componentId, attributes.size());

        if (json) {
            try {
                System.out.println(JSON_MAPPER.writeValueAsString(attributes));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize attributes: {}", e.getMessage());
                return 1;
            }
            return 0;
        }

        attributes.forEach((key, value) -> System.out.printf("%s=%s%n", key, value));
        return 0;
    }
}
