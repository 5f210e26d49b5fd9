package cifflat;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.regex.Pattern;

/** Validates model XML documents against the expected element structure. */
public class ModelGrammarValidator {

  private static final Pattern REF_PATTERN =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  public void validateModel(Element root) {
    requireTag(root, "Model");
    String modelName = attrOrNull(root, "name");
    if (modelName != null) {
      requireName(modelName, "Model name");
    }

    boolean instantiationsSeen = false;
    boolean requirementsSeen = false;

    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node node = children.item(i);
      if (!(node instanceof Element el)) continue;
      switch (el.getTagName()) {
        case "Template" -> validateTemplate(el);
        case "Instantiations" -> {
          if (instantiationsSeen) {
            throw new ModelSyntaxException("Duplicate <Instantiations> section");
          }
          instantiationsSeen = true;
          validateInstantiations(el);
        }
        case "Requirements" -> {
          if (requirementsSeen) {
            throw new ModelSyntaxException("Duplicate <Requirements> section");
          }
          requirementsSeen = true;
          validateRequirements(el);
        }
        default -> throw new ModelSyntaxException(
            "Unexpected element <" + el.getTagName() + "> in <Model>");
      }
    }
  }

  private void validateTemplate(Element templateEl) {
    String name = requireAttr(templateEl, "name", "Template name");
    requireName(name, "Template name");

    boolean paramsSeen = false;
    boolean eventsSeen = false;
    boolean locationsSeen = false;

    NodeList children = templateEl.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node node = children.item(i);
      if (!(node instanceof Element el)) continue;
      switch (el.getTagName()) {
        case "Parameters" -> {
          if (paramsSeen) {
            throw new ModelSyntaxException("Template '" + name + "' has duplicate <Parameters> sections");
          }
          paramsSeen = true;
          validateEventDecls(el, "Param");
        }
        case "Events" -> {
          if (eventsSeen) {
            throw new ModelSyntaxException("Template '" + name + "' has duplicate <Events> sections");
          }
          eventsSeen = true;
          validateEventDecls(el, "Event");
        }
        case "Locations" -> {
          if (locationsSeen) {
            throw new ModelSyntaxException("Template '" + name + "' has duplicate <Locations> sections");
          }
          locationsSeen = true;
          validateLocations(el, name);
        }
        default -> throw new ModelSyntaxException(
            "Unexpected element <" + el.getTagName() + "> in <Template>");
      }
    }

    if (!locationsSeen) {
      throw new ModelSyntaxException("Template '" + name + "' must contain a <Locations> section");
    }
  }

  private void validateEventDecls(Element parent, String expectedTag) {
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (!(node instanceof Element el)) continue;
      requireTag(el, expectedTag);
      String name = requireAttr(el, "name", expectedTag + " name");
      requireName(name, expectedTag + " name");
      String controllability = requireAttr(el, "controllability", expectedTag + " controllability");
      if (!"controllable".equals(controllability) && !"uncontrollable".equals(controllability)) {
        throw new ModelSyntaxException(
            expectedTag + " '" + name + "' must be 'controllable' or 'uncontrollable', not '" + controllability + "'");
      }
    }
  }

  private void validateLocations(Element locationsEl, String templateName) {
    NodeList nodes = locationsEl.getChildNodes();
    int count = 0;
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (!(node instanceof Element el)) continue;
      requireTag(el, "Location");
      String name = requireAttr(el, "name", "Location name");
      requireName(name, "Location name");
      requireBoolean(el, "initial");
      requireBoolean(el, "marked");
      validateEdges(el);
      count++;
    }
    if (count == 0) {
      throw new ModelSyntaxException("Template '" + templateName + "' must contain at least one <Location>");
    }
  }

  private void validateEdges(Element locationEl) {
    NodeList nodes = locationEl.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (!(node instanceof Element el)) continue;
      requireTag(el, "Edge");
      requireName(requireAttr(el, "event", "Edge event"), "Edge event");
      String target = attrOrNull(el, "target");
      if (target != null) {
        requireName(target, "Edge target");
      }
    }
  }

  private void validateInstantiations(Element parent) {
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (!(node instanceof Element el)) continue;
      requireTag(el, "Instance");
      requireName(requireAttr(el, "name", "Instance name"), "Instance name");
      requireName(requireAttr(el, "template", "Instance template"), "Instance template");
      String arguments = attrOrNull(el, "arguments");
      if (arguments == null || arguments.isEmpty()) continue;
      for (String part : arguments.split(",", -1)) {
        String ref = part.trim();
        if (!REF_PATTERN.matcher(ref).matches()) {
          throw new ModelSyntaxException("Instance argument '" + ref + "' is not an event reference");
        }
        for (String segment : ref.split("\\.")) {
          requireName(segment, "Instance argument");
        }
      }
    }
  }

  private void validateRequirements(Element parent) {
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (!(node instanceof Element el)) continue;
      requireTag(el, "Requirement");
      requireAttr(el, "guard", "Requirement guard");
      requireAttr(el, "disables", "Requirement disables");
    }
  }

  private String attrOrNull(Element element, String name) {
    return element.hasAttribute(name) ? element.getAttribute(name).trim() : null;
  }

  private void requireTag(Element element, String expected) {
    if (!expected.equals(element.getTagName())) {
      throw new ModelSyntaxException(
          "Expected <" + expected + "> but found <" + element.getTagName() + ">");
    }
  }

  private String requireAttr(Element element, String name, String description) {
    if (!element.hasAttribute(name)) {
      throw new ModelSyntaxException(
          description + " is required on <" + element.getTagName() + ">");
    }
    String value = element.getAttribute(name).trim();
    if (value.isEmpty()) {
      throw new ModelSyntaxException(
          description + " must not be blank on <" + element.getTagName() + ">");
    }
    return value;
  }

  private void requireBoolean(Element element, String name) {
    String value = attrOrNull(element, name);
    if (value != null && !"true".equals(value) && !"false".equals(value)) {
      throw new ModelSyntaxException(
          "Attribute '" + name + "' on <" + element.getTagName() + "> must be 'true' or 'false'");
    }
  }

  private void requireName(String value, String description) {
    if (!Identifiers.isIdentifier(value)) {
      throw new ModelSyntaxException(
          description + " contains an invalid identifier: '" + value + "'");
    }
  }
}
