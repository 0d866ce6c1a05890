package io.redfishcatalog.core.schema;

import io.redfishcatalog.core.error.SchemaParseException;
import io.redfishcatalog.core.model.ActionDefinition;
import io.redfishcatalog.core.model.NamespaceDefinition;
import io.redfishcatalog.core.model.NamespaceName;
import io.redfishcatalog.core.model.PropertyDefinition;
import io.redfishcatalog.core.model.QualifiedName;
import io.redfishcatalog.core.model.SchemaDocument;
import io.redfishcatalog.core.model.SchemaReference;
import io.redfishcatalog.core.model.TypeDefinition;
import io.redfishcatalog.core.model.TypeKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses one CSDL schema document into a {@link SchemaDocument}.
 *
 * <p>
 * Elements are matched by local name so that both the {@code edmx} and {@code edm} XML
 * namespaces, and documents that omit them, are accepted. Recognised structure:
 *
 * <pre>
 * Edmx
 * ├── Reference Uri=…            → SchemaReference
 * │   └── Include Namespace=… Alias=…
 * └── DataServices
 *     └── Schema Namespace=… Alias=…
 *         ├── EntityType / ComplexType Name=… BaseType=… Abstract=…
 *         │   ├── Property Name=… Type=… Nullable=…
 *         │   └── NavigationProperty Name=… Type=… Nullable=… (Annotation Term=OData.AutoExpand)
 *         ├── EnumType Name=… / Member Name=…
 *         ├── TypeDefinition Name=… UnderlyingType=…
 *         └── Action Name=… IsBound=… / Parameter Name=… Type=…
 * </pre>
 *
 * Anything else inside a {@code Schema} other than annotations, terms, functions and entity
 * containers is recorded as a diagnostic, not an error.
 *
 * <p>
 * Thread-safe: a new {@link DocumentBuilder} is created per call.
 */
public final class SchemaDocumentParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDocumentParser.class);

    private static final String AUTO_EXPAND_TERM = "OData.AutoExpand";

    /** Schema-level elements that carry nothing the catalog needs. */
    private static final Set<String> IGNORED_SCHEMA_ELEMENTS =
            Set.of("Annotation", "Annotations", "Term", "Function", "EntityContainer");

    /**
     * Reads and parses the file at {@code path}; the document is named after the file.
     *
     * @throws SchemaParseException if the file cannot be read or is not a valid schema document
     */
    public SchemaDocument parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String fileName = path.getFileName().toString();
        Document xml;
        try (InputStream in = Files.newInputStream(path)) {
            xml = readXml(new InputSource(in), fileName);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read schema file: " + e.getMessage(), e, fileName);
        }
        return toSchemaDocument(xml, fileName);
    }

    /**
     * Parses document text.
     *
     * @param text     the XML text
     * @param fileName name recorded on the document and in diagnostics
     * @throws SchemaParseException if the XML is malformed or a required attribute is missing
     */
    public SchemaDocument parse(String text, String fileName) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        return toSchemaDocument(readXml(new InputSource(new StringReader(text)), fileName), fileName);
    }

    private SchemaDocument toSchemaDocument(Document xml, String fileName) {
        Element root = xml.getDocumentElement();
        if (!"Edmx".equals(localName(root))) {
            throw new SchemaParseException(
                    "Root element must be 'Edmx' but was '" + localName(root) + "'", fileName);
        }

        List<SchemaReference> references = new ArrayList<>();
        List<NamespaceDefinition> namespaces = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();

        for (Element child : children(root)) {
            switch (localName(child)) {
                case "Reference" -> references.add(parseReference(child, fileName));
                case "DataServices" -> {
                    for (Element schema : children(child, "Schema")) {
                        namespaces.add(parseSchema(schema, fileName, diagnostics));
                    }
                }
                default -> diagnostics.add("Unrecognized element '" + localName(child) + "' under Edmx");
            }
        }

        LOG.debug(
                "Parsed schema document: file={}, namespaces={}, references={}, diagnostics={}",
                fileName,
                namespaces.size(),
                references.size(),
                diagnostics.size());
        return new SchemaDocument(fileName, namespaces, references, diagnostics);
    }

    // --- Sections ---

    private SchemaReference parseReference(Element reference, String fileName) {
        String uri = requireAttribute(reference, "Uri", fileName);
        List<SchemaReference.Include> includes = new ArrayList<>();
        for (Element include : children(reference, "Include")) {
            includes.add(new SchemaReference.Include(
                    requireAttribute(include, "Namespace", fileName), optionalAttribute(include, "Alias")));
        }
        return new SchemaReference(uri, includes);
    }

    private NamespaceDefinition parseSchema(Element schema, String fileName, List<String> diagnostics) {
        String namespaceText = requireAttribute(schema, "Namespace", fileName);
        NamespaceName namespace = NamespaceName.parse(namespaceText);

        Map<String, TypeDefinition> types = new LinkedHashMap<>();
        List<ActionDefinition> actions = new ArrayList<>();

        for (Element element : children(schema)) {
            String kind = localName(element);
            switch (kind) {
                case "EntityType" -> putType(types, parseStructured(element, namespace, TypeKind.ENTITY, fileName));
                case "ComplexType" -> putType(types, parseStructured(element, namespace, TypeKind.COMPLEX, fileName));
                case "EnumType" -> putType(types, parseEnum(element, namespace, fileName));
                case "TypeDefinition" -> putType(types, parseTypeDefinition(element, namespace, fileName));
                case "Action" -> actions.add(parseAction(element, namespace, fileName));
                default -> {
                    if (!IGNORED_SCHEMA_ELEMENTS.contains(kind)) {
                        diagnostics.add("Unrecognized element '" + kind + "' in namespace " + namespace);
                    }
                }
            }
        }

        bindActions(types, actions);
        return new NamespaceDefinition(
                namespace, optionalAttribute(schema, "Alias"), types, actions, fileName, false);
    }

    private static void putType(Map<String, TypeDefinition> types, TypeDefinition type) {
        types.put(type.name().typeName(), type);
    }

    private TypeDefinition parseStructured(Element element, NamespaceName namespace, TypeKind kind, String fileName) {
        String name = requireAttribute(element, "Name", fileName);
        QualifiedName qualifiedName = new QualifiedName(namespace, name);
        Map<String, PropertyDefinition> properties = new LinkedHashMap<>();

        for (Element child : children(element)) {
            String childKind = localName(child);
            if (!"Property".equals(childKind) && !"NavigationProperty".equals(childKind)) {
                continue;
            }
            boolean navigation = "NavigationProperty".equals(childKind);
            String propertyName = requireAttribute(child, "Name", fileName);
            PropertyDefinition property = PropertyDefinition.of(
                    propertyName,
                    requireAttribute(child, "Type", fileName),
                    !"false".equalsIgnoreCase(optionalAttribute(child, "Nullable")),
                    navigation,
                    navigation && hasAnnotation(child, AUTO_EXPAND_TERM),
                    qualifiedName.toString());
            properties.put(propertyName, property);
        }

        return new TypeDefinition(
                qualifiedName,
                kind,
                optionalAttribute(element, "BaseType"),
                "true".equalsIgnoreCase(optionalAttribute(element, "Abstract")),
                properties,
                List.of(),
                null,
                List.of(),
                fileName);
    }

    private TypeDefinition parseEnum(Element element, NamespaceName namespace, String fileName) {
        String name = requireAttribute(element, "Name", fileName);
        List<String> members = new ArrayList<>();
        for (Element member : children(element, "Member")) {
            members.add(requireAttribute(member, "Name", fileName));
        }
        return new TypeDefinition(
                new QualifiedName(namespace, name),
                TypeKind.ENUM,
                null,
                false,
                Map.of(),
                members,
                optionalAttribute(element, "UnderlyingType"),
                List.of(),
                fileName);
    }

    private TypeDefinition parseTypeDefinition(Element element, NamespaceName namespace, String fileName) {
        String name = requireAttribute(element, "Name", fileName);
        return new TypeDefinition(
                new QualifiedName(namespace, name),
                TypeKind.TYPE_DEFINITION,
                null,
                false,
                Map.of(),
                List.of(),
                requireAttribute(element, "UnderlyingType", fileName),
                List.of(),
                fileName);
    }

    private ActionDefinition parseAction(Element element, NamespaceName namespace, String fileName) {
        String name = requireAttribute(element, "Name", fileName);
        boolean bound = "true".equalsIgnoreCase(optionalAttribute(element, "IsBound"));
        String boundType = null;
        List<String> parameterNames = new ArrayList<>();
        for (Element parameter : children(element, "Parameter")) {
            if (bound && boundType == null) {
                boundType = requireAttribute(parameter, "Type", fileName);
            } else {
                parameterNames.add(requireAttribute(parameter, "Name", fileName));
            }
        }
        return new ActionDefinition(namespace + "." + name, boundType, parameterNames);
    }

    /**
     * Attaches each bound action to the type its binding parameter names, when that type is
     * declared in the same namespace. Actions bound to types elsewhere stay on the namespace only.
     */
    private static void bindActions(Map<String, TypeDefinition> types, List<ActionDefinition> actions) {
        if (actions.isEmpty()) {
            return;
        }
        for (Map.Entry<String, TypeDefinition> entry : types.entrySet()) {
            TypeDefinition type = entry.getValue();
            List<ActionDefinition> bound = new ArrayList<>();
            for (ActionDefinition action : actions) {
                if (action.boundType() != null
                        && QualifiedName.parse(PropertyDefinition.elementType(action.boundType()))
                                .typeName()
                                .equals(type.name().typeName())) {
                    bound.add(action);
                }
            }
            if (!bound.isEmpty()) {
                entry.setValue(type.withActions(bound));
            }
        }
    }

    // --- DOM helpers ---

    private static Document readXml(InputSource source, String fileName) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            // No DTDs, hence no external entities
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler(fileName));
            return builder.parse(source);
        } catch (SAXException e) {
            throw new SchemaParseException("Malformed schema XML: " + e.getMessage(), e, fileName);
        } catch (ParserConfigurationException | IOException e) {
            throw new SchemaParseException("Failed to parse schema XML: " + e.getMessage(), e, fileName);
        }
    }

    /** Turns parser errors into exceptions instead of the default stderr output. */
    private record RethrowingErrorHandler(String fileName) implements ErrorHandler {

        @Override
        public void warning(SAXParseException e) {
            LOG.warn("Schema XML warning: file={}, line={}, detail={}", fileName, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }

    private static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    private static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Element child : children(parent)) {
            if (name.equals(localName(child))) {
                result.add(child);
            }
        }
        return result;
    }

    private static boolean hasAnnotation(Element element, String term) {
        for (Element annotation : children(element, "Annotation")) {
            if (term.equals(annotation.getAttribute("Term"))) {
                return true;
            }
        }
        return false;
    }

    private static String optionalAttribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static String requireAttribute(Element element, String name, String fileName) {
        String value = optionalAttribute(element, name);
        if (value == null || value.isBlank()) {
            throw new SchemaParseException(
                    "Element '" + localName(element) + "' is missing required attribute '" + name + "'", fileName);
        }
        return value;
    }
}
