package io.buildeval.core.construction;

import io.buildeval.core.error.InvalidProjectFileException;
import io.buildeval.core.sdk.SdkReference;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Parses project files into {@link ProjectRootElement} trees.
 *
 * <p>
 * Parsing runs in two steps: a SAX pass builds a raw node tree that records the
 * source location of every element, then the raw tree is converted into typed
 * elements, rejecting constructs that are not allowed in their context. SDK
 * references on the project are expanded into implicit {@code Sdk.props} /
 * {@code Sdk.targets} imports at the top and bottom of the project.
 *
 * <p>
 * Thread-safe: no state is shared between calls.
 */
public final class ProjectXmlParser {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectXmlParser.class);

    public static final String INVALID_XML_CODE = "MSB4025";
    public static final String UNRECOGNIZED_ELEMENT_CODE = "MSB4067";
    public static final String UNRECOGNIZED_ROOT_CODE = "MSB4068";
    public static final String MISSING_ATTRIBUTE_CODE = "MSB4035";
    public static final String RESERVED_PROPERTY_CODE = "MSB4004";
    public static final String INVALID_NAME_CODE = "MSB4036";

    private static final Set<String> ITEM_RESERVED_ATTRIBUTES = Set.of(
            "Include",
            "Exclude",
            "Remove",
            "Update",
            "Condition",
            "KeepMetadata",
            "RemoveMetadata",
            "KeepDuplicates",
            "MatchOnMetadata",
            "MatchOnMetadataOptions");

    /** Parses the file at {@code path}. */
    public ProjectRootElement parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path fullPath = path.toAbsolutePath().normalize();
        ElementLocation fileLocation = ElementLocation.ofFile(fullPath.toString());
        try {
            Instant lastWrite = Files.getLastModifiedTime(fullPath).toInstant();
            try (InputStream in = Files.newInputStream(fullPath)) {
                RawNode raw = readRaw(in, fullPath);
                LOG.debug("Parsed project file: path={}", fullPath);
                return convertRoot(raw, fullPath, lastWrite);
            }
        } catch (NoSuchFileException e) {
            throw new InvalidProjectFileException(
                    "The project file could not be loaded. Could not find file '" + fullPath + "'.",
                    e,
                    INVALID_XML_CODE,
                    fileLocation);
        } catch (IOException e) {
            throw new InvalidProjectFileException(
                    "The project file could not be loaded. " + e.getMessage(), e, INVALID_XML_CODE, fileLocation);
        }
    }

    /**
     * Parses in-memory project text as if it were the file at {@code fullPath}.
     */
    public ProjectRootElement parse(String content, Path fullPath) {
        Objects.requireNonNull(content, "content must not be null");
        Path normalized = fullPath.toAbsolutePath().normalize();
        RawNode raw = readRaw(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), normalized);
        return convertRoot(raw, normalized, Instant.EPOCH);
    }

    // --- SAX pass ---

    private RawNode readRaw(InputStream in, Path fullPath) {
        String file = fullPath.toString();
        RawHandler handler = new RawHandler(file);
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            SAXParser parser = factory.newSAXParser();
            InputSource source = new InputSource(in);
            source.setSystemId(fullPath.toUri().toString());
            parser.parse(source, handler);
        } catch (SAXParseException e) {
            throw new InvalidProjectFileException(
                    "The project file could not be loaded. " + e.getMessage(),
                    e,
                    INVALID_XML_CODE,
                    new ElementLocation(file, Math.max(e.getLineNumber(), 0), Math.max(e.getColumnNumber(), 0)));
        } catch (SAXException | ParserConfigurationException | IOException e) {
            throw new InvalidProjectFileException(
                    "The project file could not be loaded. " + e.getMessage(),
                    e,
                    INVALID_XML_CODE,
                    ElementLocation.ofFile(file));
        }
        if (handler.root == null) {
            throw new InvalidProjectFileException(
                    "The project file could not be loaded. Root element is missing.",
                    INVALID_XML_CODE,
                    ElementLocation.ofFile(file));
        }
        return handler.root;
    }

    /**
     * Element as read from XML, before validation. Content interleaves text and
     * child nodes.
     */
    private static final class RawNode {
        final String name;
        final Map<String, String> attributes;
        final ElementLocation location;
        final List<Object> content = new ArrayList<>();

        RawNode(String name, Map<String, String> attributes, ElementLocation location) {
            this.name = name;
            this.attributes = attributes;
            this.location = location;
        }

        List<RawNode> children() {
            List<RawNode> result = new ArrayList<>();
            for (Object o : content) {
                if (o instanceof RawNode) {
                    result.add((RawNode) o);
                }
            }
            return result;
        }

        String innerXml() {
            StringBuilder sb = new StringBuilder();
            for (Object o : content) {
                if (o instanceof RawNode) {
                    ((RawNode) o).appendOuterXml(sb);
                } else {
                    sb.append(o);
                }
            }
            return sb.toString();
        }

        private void appendOuterXml(StringBuilder sb) {
            sb.append('<').append(name);
            attributes.forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(v).append('"'));
            String inner = innerXml();
            if (inner.isEmpty()) {
                sb.append(" />");
            } else {
                sb.append('>').append(inner).append("</").append(name).append('>');
            }
        }
    }

    private static final class RawHandler extends DefaultHandler {
        private final String file;
        private final Deque<RawNode> stack = new ArrayDeque<>();
        private Locator locator;
        private RawNode root;

        RawHandler(String file) {
            this.file = file;
        }

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts) {
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < atts.getLength(); i++) {
                String attrName = atts.getLocalName(i);
                if (attrName == null || attrName.isEmpty()) {
                    attrName = atts.getQName(i);
                }
                if (attrName.startsWith("xmlns")) {
                    continue;
                }
                attributes.put(attrName, atts.getValue(i));
            }
            int line = locator != null ? locator.getLineNumber() : 0;
            int column = locator != null ? locator.getColumnNumber() : 0;
            String name = localName == null || localName.isEmpty() ? qName : localName;
            RawNode node = new RawNode(name, attributes, new ElementLocation(file, line, column));
            if (stack.isEmpty()) {
                root = node;
            } else {
                stack.peek().content.add(node);
            }
            stack.push(node);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            stack.pop();
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (!stack.isEmpty()) {
                stack.peek().content.add(new String(ch, start, length));
            }
        }
    }

    // --- Conversion to typed elements ---

    private ProjectRootElement convertRoot(RawNode raw, Path fullPath, Instant lastWrite) {
        if (!"Project".equals(raw.name)) {
            throw new InvalidProjectFileException(
                    "The element <" + raw.name + "> is unrecognized, or not supported in this context.",
                    UNRECOGNIZED_ROOT_CODE,
                    raw.location);
        }
        ProjectRootElement root = new ProjectRootElement(fullPath, lastWrite, raw.attributes, raw.location);

        List<SdkReference> sdks = new ArrayList<>(
                SdkReference.parseList(raw.attributes.getOrDefault("Sdk", ""), raw.location));
        List<ElementLocation> sdkLocations = new ArrayList<>();
        sdks.forEach(s -> sdkLocations.add(raw.location));
        for (RawNode child : raw.children()) {
            if ("Sdk".equals(child.name)) {
                String name = child.attributes.getOrDefault("Name", "");
                if (name.isBlank()) {
                    throw missingAttribute("Name", child);
                }
                sdks.add(new SdkReference(
                        name, child.attributes.get("Version"), child.attributes.get("MinimumVersion")));
                sdkLocations.add(child.location);
            }
        }

        for (int i = 0; i < sdks.size(); i++) {
            root.addChild(implicitImport("Sdk.props", sdks.get(i), sdkLocations.get(i)));
        }
        for (RawNode child : raw.children()) {
            switch (child.name) {
                case "PropertyGroup" -> root.addChild(convertPropertyGroup(child));
                case "ItemGroup" -> root.addChild(convertItemGroup(child, false));
                case "ItemDefinitionGroup" -> root.addChild(convertItemDefinitionGroup(child));
                case "Import" -> root.addChild(convertImport(child));
                case "ImportGroup" -> root.addChild(convertImportGroup(child));
                case "Choose" -> root.addChild(convertChoose(child));
                case "Target" -> root.addChild(convertTarget(child));
                case "Sdk" -> root.addSdkElement(new SdkElement(child.attributes, child.location));
                case "UsingTask", "ProjectExtensions" -> LOG.trace("Skipping <{}> at {}", child.name, child.location);
                default -> throw unrecognized(child, raw);
            }
        }
        for (int i = 0; i < sdks.size(); i++) {
            root.addChild(implicitImport("Sdk.targets", sdks.get(i), sdkLocations.get(i)));
        }
        return root;
    }

    private static ImportElement implicitImport(String project, SdkReference sdk, ElementLocation location) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("Project", project);
        attributes.put("Sdk", sdk.name());
        if (sdk.version() != null) {
            attributes.put("Version", sdk.version());
        }
        if (sdk.minimumVersion() != null) {
            attributes.put("MinimumVersion", sdk.minimumVersion());
        }
        return new ImportElement(attributes, location, true);
    }

    private PropertyGroupElement convertPropertyGroup(RawNode raw) {
        PropertyGroupElement group = new PropertyGroupElement(raw.attributes, raw.location);
        for (RawNode child : raw.children()) {
            requireValidName(child);
            if (ReservedPropertyNames.isReserved(child.name)) {
                throw new InvalidProjectFileException(
                        "The \"" + child.name + "\" property is reserved, and cannot be modified.",
                        RESERVED_PROPERTY_CODE,
                        child.location);
            }
            group.addChild(new PropertyElement(child.name, child.innerXml(), child.attributes, child.location));
        }
        return group;
    }

    private ItemGroupElement convertItemGroup(RawNode raw, boolean insideTarget) {
        ItemGroupElement group = new ItemGroupElement(raw.attributes, raw.location);
        for (RawNode child : raw.children()) {
            requireValidName(child);
            boolean hasOperation = !child.attributes.getOrDefault("Include", "").isEmpty()
                    || !child.attributes.getOrDefault("Remove", "").isEmpty()
                    || !child.attributes.getOrDefault("Update", "").isEmpty();
            if (!insideTarget && !hasOperation) {
                throw missingAttribute("Include", child);
            }
            ItemElement item = new ItemElement(child.name, child.attributes, child.location);
            child.attributes.forEach((name, value) -> {
                if (!ITEM_RESERVED_ATTRIBUTES.contains(name)) {
                    item.addChild(new MetadataElement(name, value, true, Map.of(), child.location));
                }
            });
            addMetadataChildren(item, child);
            group.addChild(item);
        }
        return group;
    }

    private ItemDefinitionGroupElement convertItemDefinitionGroup(RawNode raw) {
        ItemDefinitionGroupElement group = new ItemDefinitionGroupElement(raw.attributes, raw.location);
        for (RawNode child : raw.children()) {
            requireValidName(child);
            ItemDefinitionElement definition = new ItemDefinitionElement(child.name, child.attributes, child.location);
            child.attributes.forEach((name, value) -> {
                if (!"Condition".equals(name)) {
                    definition.addChild(new MetadataElement(name, value, true, Map.of(), child.location));
                }
            });
            addMetadataChildren(definition, child);
            group.addChild(definition);
        }
        return group;
    }

    private void addMetadataChildren(ProjectElementContainer owner, RawNode raw) {
        for (RawNode metadata : raw.children()) {
            requireValidName(metadata);
            owner.addChild(
                    new MetadataElement(metadata.name, metadata.innerXml(), false, metadata.attributes, metadata.location));
        }
    }

    private ImportElement convertImport(RawNode raw) {
        if (raw.attributes.getOrDefault("Project", "").isEmpty()) {
            throw missingAttribute("Project", raw);
        }
        if (!raw.children().isEmpty()) {
            throw unrecognized(raw.children().get(0), raw);
        }
        return new ImportElement(raw.attributes, raw.location, false);
    }

    private ImportGroupElement convertImportGroup(RawNode raw) {
        ImportGroupElement group = new ImportGroupElement(raw.attributes, raw.location);
        for (RawNode child : raw.children()) {
            if (!"Import".equals(child.name)) {
                throw unrecognized(child, raw);
            }
            group.addChild(convertImport(child));
        }
        return group;
    }

    private ChooseElement convertChoose(RawNode raw) {
        ChooseElement choose = new ChooseElement(raw.attributes, raw.location);
        boolean sawOtherwise = false;
        boolean sawWhen = false;
        for (RawNode child : raw.children()) {
            if ("When".equals(child.name) && !sawOtherwise) {
                if (child.attributes.getOrDefault("Condition", "").isEmpty()) {
                    throw missingAttribute("Condition", child);
                }
                WhenElement when = new WhenElement(child.attributes, child.location);
                convertBranchChildren(when, child);
                choose.addChild(when);
                sawWhen = true;
            } else if ("Otherwise".equals(child.name) && sawWhen && !sawOtherwise) {
                OtherwiseElement otherwise = new OtherwiseElement(child.attributes, child.location);
                convertBranchChildren(otherwise, child);
                choose.addChild(otherwise);
                sawOtherwise = true;
            } else {
                throw unrecognized(child, raw);
            }
        }
        if (!sawWhen) {
            throw new InvalidProjectFileException(
                    "A <Choose> element must contain at least one <When> element.", "MSB4114", raw.location);
        }
        return choose;
    }

    private void convertBranchChildren(ProjectElementContainer branch, RawNode raw) {
        for (RawNode child : raw.children()) {
            switch (child.name) {
                case "PropertyGroup" -> branch.addChild(convertPropertyGroup(child));
                case "ItemGroup" -> branch.addChild(convertItemGroup(child, false));
                case "Choose" -> branch.addChild(convertChoose(child));
                default -> throw unrecognized(child, raw);
            }
        }
    }

    private TargetElement convertTarget(RawNode raw) {
        if (raw.attributes.getOrDefault("Name", "").isBlank()) {
            throw missingAttribute("Name", raw);
        }
        TargetElement target = new TargetElement(raw.attributes, raw.location);
        for (RawNode child : raw.children()) {
            switch (child.name) {
                case "PropertyGroup" -> target.addChild(convertPropertyGroup(child));
                case "ItemGroup" -> target.addChild(convertItemGroup(child, true));
                default -> target.addChild(new TaskElement(child.name, child.attributes, child.location));
            }
        }
        return target;
    }

    private static void requireValidName(RawNode raw) {
        if (!XmlNames.isValidName(raw.name)) {
            throw new InvalidProjectFileException(
                    "The name \"" + raw.name + "\" contains an invalid character.", INVALID_NAME_CODE, raw.location);
        }
    }

    private static InvalidProjectFileException unrecognized(RawNode child, RawNode parent) {
        return new InvalidProjectFileException(
                "The element <" + child.name + "> beneath element <" + parent.name + "> is unrecognized.",
                UNRECOGNIZED_ELEMENT_CODE,
                child.location);
    }

    private static InvalidProjectFileException missingAttribute(String attribute, RawNode raw) {
        return new InvalidProjectFileException(
                "The required attribute \"" + attribute + "\" is empty or missing from the element <" + raw.name + ">.",
                MISSING_ATTRIBUTE_CODE,
                raw.location);
    }
}
