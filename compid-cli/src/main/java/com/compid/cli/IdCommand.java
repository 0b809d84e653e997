package com.compid.cli;

import com.compid.core.id.IdentifierCodec;
import com.compid.core.model.ComponentAttributes;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Command to build a component identifier from its attributes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Full identifier
 * compid id --vendor ARM --class "CMSIS Driver" --group USART --version 2.1.0
 *
 * # Aggregate identifier (no variant, no version)
 * compid id --class Device --group Startup --variant C --kind aggregate
 * }</pre>
 */
@Command(
    name = "id",
    description = "Build a component identifier from attributes"
)
public class IdCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IdCommand.class);

    /**
     * Identifier flavours.
     */
    public enum Kind {
        /** Every attribute */
        FULL,
        /** Without variant and version */
        AGGREGATE,
        /** Without vendor and version */
        PARTIAL
    }

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean helpRequested;

    @Option(names = "--vendor", description = "Component vendor")
    private String vendor;

    @Option(names = "--class", required = true, description = "Component class")
    private String cclass;

    @Option(names = "--bundle", description = "Bundle name")
    private String bundle;

    @Option(names = "--group", description = "Group name")
    private String group;

    @Option(names = "--sub", description = "Sub-group name")
    private String sub;

    @Option(names = "--variant", description = "Variant name")
    private String variant;

    @Option(names = "--version", description = "Component version")
    private String version;

    @Option(names = "--kind", defaultValue = "FULL",
        description = "Identifier kind: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Kind kind;

    @Override
    public Integer call() {
        ComponentAttributes attributes =
            new ComponentAttributes(vendor, cclass, bundle, group, sub, variant, version);
        log.debug("Building {} identifier for {}", kind, attributes);

        String id = switch (kind) {
            case FULL -> IdentifierCodec.componentId(attributes);
            case AGGREGATE -> IdentifierCodec.componentAggregateId(attributes);
            case PARTIAL -> IdentifierCodec.partialComponentId(attributes);
        };
        System.out.println(id);
        return 0;
    }
}
