package com.al.ccda2omop.service.parser;

import com.al.ccda2omop.exception.CcdaParseException;
import com.al.ccda2omop.model.ccda.ClinicalDocument;
import com.al.ccda2omop.model.ccda.CodedValue;
import com.al.ccda2omop.model.ccda.EffectiveTime;
import com.al.ccda2omop.model.ccda.Encounter;
import com.al.ccda2omop.model.ccda.Patient;
import com.al.ccda2omop.model.ccda.SectionMetadata;
import com.al.ccda2omop.model.ccda.SectionType;
import com.al.ccda2omop.service.engine.RuleEngine;
import com.al.ccda2omop.service.engine.XmlExtractor;
import com.al.ccda2omop.util.Hl7Time;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses C-CDA XML into a {@link ClinicalDocument}.
 *
 * <p>
 * Namespace prefixes are dropped from element names so rule XPath can be
 * written without namespace bindings. DOCTYPE declarations are rejected.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class CcdaParser {

    private static final String PATIENT_ROLE = ".//recordTarget/patientRole";

    public ClinicalDocument parse(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new CcdaParseException("Cannot read " + file, e);
        }
    }

    public ClinicalDocument parse(byte[] xml, String sourceName) {
        return parse(new ByteArrayInputStream(xml), sourceName);
    }

    public ClinicalDocument parse(InputStream in, String sourceName) {
        Document document;
        try {
            document = newBuilder().parse(in);
        } catch (SAXException | IOException e) {
            throw new CcdaParseException("Malformed XML in " + sourceName + ": " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();
        stripPrefixes(document, root);
        return parseDocument(root);
    }

    private ClinicalDocument parseDocument(Element root) {
        Patient patient = parsePatient(root);
        List<Encounter> encounters = new ArrayList<>();
        List<SectionFound> found = new ArrayList<>();

        for (Element section : XmlExtractor.elements(root, "//component/section")) {
            Optional<String> oid = templateOid(section);
            if (oid.isEmpty()) {
                continue;
            }
            SectionType type = SectionType.fromTemplateOid(oid.get()).orElseThrow();
            List<Element> entries = new ArrayList<>();
            for (Element entry : XmlExtractor.elements(section, type.defaultEntryPath())) {
                if (RuleEngine.shouldInclude(entry)) {
                    entries.add(entry);
                }
            }
            boolean entriesRequired = oid.get().equals(type.entriesRequiredOid());
            found.add(new SectionFound(type, new SectionMetadata(oid.get(), entriesRequired), entries));
            if (type == SectionType.ENCOUNTERS) {
                encounters.clear();
                entries.forEach(e -> encounters.add(parseEncounter(e)));
            }
        }

        ClinicalDocument doc = new ClinicalDocument(root, patient, encounters);
        found.forEach(s -> doc.addSection(s.type, s.metadata, s.entries));
        log.debug("Parsed document for patient '{}': {} encounters, {} sections", patient.getId(),
                encounters.size(), found.size());
        return doc;
    }

    /**
     * First {@code templateId/@root} of the section that names a known section.
     */
    private static Optional<String> templateOid(Element section) {
        for (Element template : XmlExtractor.elements(section, "templateId")) {
            String oid = template.getAttribute("root");
            if (SectionType.fromTemplateOid(oid).isPresent()) {
                return Optional.of(oid);
            }
        }
        return Optional.empty();
    }

    private Patient parsePatient(Element root) {
        Patient patient = Patient.builder().build();
        Element id = element(root, PATIENT_ROLE + "/id");
        if (id != null) {
            String extension = id.getAttribute("extension");
            patient.setId(extension.isEmpty() ? id.getAttribute("root") : extension);
        }
        Element name = element(root, PATIENT_ROLE + "/patient/name");
        if (name != null) {
            patient.setGivenName(XmlExtractor.string(name, "given"));
            patient.setFamilyName(XmlExtractor.string(name, "family"));
        }
        Element birthTime = element(root, PATIENT_ROLE + "/patient/birthTime");
        if (birthTime != null) {
            patient.setBirthTime(Hl7Time.parse(birthTime.getAttribute("value")));
        }
        patient.setGender(code(element(root, PATIENT_ROLE + "/patient/administrativeGenderCode")));
        patient.setRace(code(element(root, PATIENT_ROLE + "/patient/raceCode")));
        patient.setEthnicity(code(element(root, PATIENT_ROLE + "/patient/ethnicGroupCode")));
        return patient;
    }

    private Encounter parseEncounter(Element encounter) {
        String id = "";
        Element idElement = XmlExtractor.child(encounter, "id");
        if (idElement != null) {
            String extension = idElement.getAttribute("extension");
            id = extension.isEmpty() ? idElement.getAttribute("root") : extension;
        }
        return Encounter.builder()
                .id(id)
                .code(code(XmlExtractor.child(encounter, "code")))
                .effectiveTime(effectiveTime(XmlExtractor.child(encounter, "effectiveTime")))
                .build();
    }

    static CodedValue code(Element element) {
        if (element == null) {
            return CodedValue.empty();
        }
        Element originalText = XmlExtractor.child(element, "originalText");
        return CodedValue.builder()
                .code(element.getAttribute("code"))
                .codeSystem(element.getAttribute("codeSystem"))
                .codeSystemName(element.getAttribute("codeSystemName"))
                .displayName(element.getAttribute("displayName"))
                .originalText(originalText == null ? "" : originalText.getTextContent().trim())
                .build();
    }

    static EffectiveTime effectiveTime(Element element) {
        if (element == null) {
            return EffectiveTime.empty();
        }
        Element low = XmlExtractor.child(element, "low");
        Element high = XmlExtractor.child(element, "high");
        return EffectiveTime.builder()
                .value(Hl7Time.parse(element.getAttribute("value")))
                .low(low == null ? null : Hl7Time.parse(low.getAttribute("value")))
                .high(high == null ? null : Hl7Time.parse(high.getAttribute("value")))
                .build();
    }

    private static Element element(Element context, String xpath) {
        Node node = XmlExtractor.first(context, xpath);
        return node instanceof Element ? (Element) node : null;
    }

    private static void stripPrefixes(Document document, Element element) {
        String name = element.getNodeName();
        int colon = name.indexOf(':');
        Element current = element;
        if (colon >= 0) {
            current = (Element) document.renameNode(element, null, name.substring(colon + 1));
        }
        NodeList children = current.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element) {
                stripPrefixes(document, (Element) children.item(i));
            }
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static final class SectionFound {
        private final SectionType type;
        private final SectionMetadata metadata;
        private final List<Element> entries;

        private SectionFound(SectionType type, SectionMetadata metadata, List<Element> entries) {
            this.type = type;
            this.metadata = metadata;
            this.entries = entries;
        }
    }
}
