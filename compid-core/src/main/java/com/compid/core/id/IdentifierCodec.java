package com.compid.core.id;

import com.compid.core.model.ComponentAttributes;
import com.compid.core.model.PackageAttributes;
import com.compid.core.util.DelimiterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and parses the canonical identifiers of components, component aggregates
 * and packs.
 *
 * <p>A full component identifier has the shape
 * <pre>{@code
 * [Cvendor::]Cclass[&Cbundle][:Cgroup][:Csub][&Cvariant][@Cversion]
 * }</pre>
 * Absent fields are dropped together with their delimiter, so the order of the
 * present fields is fixed regardless of how the attributes were supplied.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String id = IdentifierCodec.componentId(
 *     ComponentAttributes.of("Driver").group("USART").version("1.0.0").build());
 * // "Driver:USART@1.0.0"
 *
 * ComponentAttributes parsed = IdentifierCodec.decompose(id);
 * }</pre>
 *
 * <p>Decomposition never fails: malformed input yields partially populated fields.
 * An identifier carrying a variant on both the group and the sub segment keeps the
 * sub segment's variant. Segments are positional: a sub encoded without a group
 * decodes as the group, and a variant encoded without a group decodes as the bundle.
 */
public final class IdentifierCodec {

    private static final Logger log = LoggerFactory.getLogger(IdentifierCodec.class);

    public static final String SUFFIX_CVENDOR = "::";
    public static final String PREFIX_CBUNDLE = "&";
    public static final String PREFIX_CGROUP = ":";
    public static final String PREFIX_CSUB = ":";
    public static final String PREFIX_CVARIANT = "&";
    public static final String PREFIX_CVERSION = "@";
    public static final String SUFFIX_PACK_VENDOR = "::";
    public static final String PREFIX_PACK_VERSION = "@";

    private static final char CBUNDLE_CHAR = '&';
    private static final char CVARIANT_CHAR = '&';
    private static final char CVERSION_CHAR = '@';
    private static final char SEGMENT_CHAR = ':';

    private IdentifierCodec() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Concatenates {@code delimiter + value} for every element with a non-empty value,
     * in list order. Empty elements contribute nothing, not even their delimiter.
     *
     * @param elements ordered identifier fields
     * @return identifier string
     */
    public static String constructId(List<IdElement> elements) {
        StringBuilder id = new StringBuilder();
        for (IdElement element : elements) {
            if (element.isPresent()) {
                id.append(element.delimiter()).append(element.value());
            }
        }
        return id.toString();
    }

    /**
     * Fully specified component identifier.
     *
     * @param component component attributes, class name required
     * @return identifier, or empty string for {@code null}
     */
    public static String componentId(ComponentAttributes component) {
        if (component == null) {
            return "";
        }
        return constructId(List.of(
            IdElement.of("", vendorPart(component.vendor(), SUFFIX_CVENDOR)),
            IdElement.of("", component.cclass()),
            IdElement.of(PREFIX_CBUNDLE, component.bundle()),
            IdElement.of(PREFIX_CGROUP, component.group()),
            IdElement.of(PREFIX_CSUB, component.sub()),
            IdElement.of(PREFIX_CVARIANT, component.variant()),
            IdElement.of(PREFIX_CVERSION, component.version())
        ));
    }

    /**
     * Identifier of the family of variants and versions a component belongs to.
     *
     * @param component component attributes
     * @return aggregate identifier, or empty string for {@code null}
     */
    public static String componentAggregateId(ComponentAttributes component) {
        if (component == null) {
            return "";
        }
        return constructId(List.of(
            IdElement.of("", vendorPart(component.vendor(), SUFFIX_CVENDOR)),
            IdElement.of("", component.cclass()),
            IdElement.of(PREFIX_CBUNDLE, component.bundle()),
            IdElement.of(PREFIX_CGROUP, component.group()),
            IdElement.of(PREFIX_CSUB, component.sub())
        ));
    }

    /**
     * Component identifier without vendor and version.
     *
     * @param component component attributes
     * @return partial identifier, or empty string for {@code null}
     */
    public static String partialComponentId(ComponentAttributes component) {
        if (component == null) {
            return "";
        }
        return constructId(List.of(
            IdElement.of("", component.cclass()),
            IdElement.of(PREFIX_CBUNDLE, component.bundle()),
            IdElement.of(PREFIX_CGROUP, component.group()),
            IdElement.of(PREFIX_CSUB, component.sub()),
            IdElement.of(PREFIX_CVARIANT, component.variant())
        ));
    }

    /**
     * Identifier of a condition: its tag followed by the component identifier of its
     * attributes, e.g. {@code require ARM::Device:Startup}.
     *
     * @param tag condition tag such as {@code require} or {@code accept}
     * @param attributes attributes referenced by the condition
     * @return condition identifier, or empty string for {@code null} attributes
     */
    public static String conditionId(String tag, ComponentAttributes attributes) {
        if (attributes == null) {
            return "";
        }
        return (tag == null ? "" : tag) + " " + componentId(attributes);
    }

    /**
     * Fully specified pack identifier {@code [vendor::]name[@version]}.
     *
     * @param pack pack attributes
     * @return pack identifier, or empty string for {@code null}
     */
    public static String packageId(PackageAttributes pack) {
        if (pack == null) {
            return "";
        }
        return packageId(pack.vendor(), pack.name(), pack.version());
    }

    /**
     * Pack identifier from loose strings. An empty vendor is dropped together with
     * its {@code ::} suffix.
     *
     * @param vendor pack vendor
     * @param name pack name
     * @param version pack version
     * @return pack identifier
     */
    public static String packageId(String vendor, String name, String version) {
        return constructId(List.of(
            IdElement.of("", vendorPart(vendor, SUFFIX_PACK_VENDOR)),
            IdElement.of("", name),
            IdElement.of(PREFIX_PACK_VERSION, version)
        ));
    }

    /**
     * Parses a full component identifier back into its attributes.
     *
     * @param componentId component identifier
     * @return attributes, absent fields empty
     */
    public static ComponentAttributes decompose(String componentId) {
        return ComponentAttributes.fromMap(attributesFromId(componentId));
    }

    /**
     * Parses a full component identifier into a metadata attribute map.
     *
     * <p>{@code Cvendor} is present only when the identifier contains {@code ::};
     * {@code Cversion} is always present; {@code Cclass}, {@code Cgroup} and
     * {@code Csub} are present whenever their segment exists; {@code Cbundle} and
     * {@code Cvariant} only when non-empty. Segments beyond the third are ignored.
     *
     * @param componentId component identifier
     * @return insertion-ordered attribute map
     */
    public static Map<String, String> attributesFromId(String componentId) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (componentId == null) {
            return attributes;
        }
        String id = componentId;
        int vendorEnd = id.indexOf(SUFFIX_CVENDOR);
        if (vendorEnd >= 0) {
            attributes.put(ComponentAttributes.CVENDOR, id.substring(0, vendorEnd));
            id = id.substring(vendorEnd + SUFFIX_CVENDOR.length());
        }
        attributes.put(ComponentAttributes.CVERSION, DelimiterUtils.suffix(id, CVERSION_CHAR));
        id = DelimiterUtils.prefix(id, CVERSION_CHAR);

        String[] segments = id.split(String.valueOf(SEGMENT_CHAR), -1);
        for (int index = 0; index < segments.length && index < 3; index++) {
            String segment = segments[index];
            switch (index) {
                case 0 -> {
                    attributes.put(ComponentAttributes.CCLASS, DelimiterUtils.prefix(segment, CBUNDLE_CHAR));
                    putIfNotEmpty(attributes, ComponentAttributes.CBUNDLE, DelimiterUtils.suffix(segment, CBUNDLE_CHAR));
                }
                case 1 -> {
                    attributes.put(ComponentAttributes.CGROUP, DelimiterUtils.prefix(segment, CVARIANT_CHAR));
                    putIfNotEmpty(attributes, ComponentAttributes.CVARIANT, DelimiterUtils.suffix(segment, CVARIANT_CHAR));
                }
                default -> {
                    attributes.put(ComponentAttributes.CSUB, DelimiterUtils.prefix(segment, CVARIANT_CHAR));
                    String variant = DelimiterUtils.suffix(segment, CVARIANT_CHAR);
                    if (!variant.isEmpty() && attributes.containsKey(ComponentAttributes.CVARIANT)) {
                        log.debug("Variant '{}' on sub segment replaces '{}' in {}",
                            variant, attributes.get(ComponentAttributes.CVARIANT), componentId);
                    }
                    putIfNotEmpty(attributes, ComponentAttributes.CVARIANT, variant);
                }
            }
        }
        return attributes;
    }

    private static String vendorPart(String vendor, String suffix) {
        return vendor == null || vendor.isEmpty() ? "" : vendor + suffix;
    }

    private static void putIfNotEmpty(Map<String, String> attributes, String key, String value) {
        if (!value.isEmpty()) {
            attributes.put(key, value);
        }
    }
}
