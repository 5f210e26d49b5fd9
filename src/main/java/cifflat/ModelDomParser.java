package cifflat;

import org.w3c.dom.*;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** DOM parser for model XML → ModelSource. */
public class ModelDomParser {

  private final ModelGrammarValidator validator;

  public ModelDomParser() {
    this(new ModelGrammarValidator());
  }

  public ModelDomParser(ModelGrammarValidator validator) {
    this.validator = validator;
  }

  public ModelSource parse(Path xmlPath) throws IOException {
    try (InputStream in = new FileInputStream(xmlPath.toFile())) {
      return parse(in);
    }
  }

  public ModelSource parse(InputStream in) throws IOException {
    Document doc;
    try {
      DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
      // models arrive over HTTP: no DOCTYPE, no entity expansion
      f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      f.setExpandEntityReferences(false);
      f.setXIncludeAware(false);
      f.setNamespaceAware(true);
      f.setIgnoringComments(true);
      f.setCoalescing(true);
      DocumentBuilder b = f.newDocumentBuilder();
      doc = b.parse(in);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser unavailable", e);
    } catch (SAXException e) {
      throw new ModelSyntaxException("Malformed model document: " + e.getMessage());
    }

    Element root = doc.getDocumentElement();
    if (root == null) throw new ModelSyntaxException("Empty model document");
    validator.validateModel(root);
    return parseModel(root);
  }

  private ModelSource parseModel(Element root) {
    ModelSource model = new ModelSource();
    model.name = attrOr(root, "name", model.name);

    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node n = children.item(i);
      if (!(n instanceof Element)) continue;
      Element el = (Element) n;
      switch (el.getTagName()) {
        case "Template" -> model.templates.add(parseTemplate(el));
        case "Instantiations" -> parseInstantiations(el, model);
        case "Requirements" -> parseRequirements(el, model);
        default -> {
          // rejected by the validator
        }
      }
    }
    return model;
  }

  private ModelSource.Template parseTemplate(Element templateEl) {
    ModelSource.Template template = new ModelSource.Template(attr(templateEl, "name"));

    Element paramsEl = child(templateEl, "Parameters");
    if (paramsEl != null) {
      for (Element pEl : children(paramsEl, "Param")) {
        template.parameter(attr(pEl, "name"), Controllability.fromKeyword(attr(pEl, "controllability")));
      }
    }

    Element eventsEl = child(templateEl, "Events");
    if (eventsEl != null) {
      for (Element eEl : children(eventsEl, "Event")) {
        template.event(attr(eEl, "name"), Controllability.fromKeyword(attr(eEl, "controllability")));
      }
    }

    // Edges are nested in their source location
    Element locationsEl = child(templateEl, "Locations");
    if (locationsEl != null) {
      for (Element lEl : children(locationsEl, "Location")) {
        String locName = attr(lEl, "name");
        template.location(locName, flag(lEl, "initial"), flag(lEl, "marked"));
        for (Element edgeEl : children(lEl, "Edge")) {
          template.edge(locName, attr(edgeEl, "event"), attr(edgeEl, "target"));
        }
      }
    }
    return template;
  }

  private void parseInstantiations(Element parent, ModelSource model) {
    for (Element iEl : children(parent, "Instance")) {
      ModelSource.Instantiation inst = new ModelSource.Instantiation();
      inst.instanceName = attr(iEl, "name");
      inst.templateName = attr(iEl, "template");
      String args = attr(iEl, "arguments");
      if (args != null && !args.isEmpty()) {
        for (String part : args.split(",")) {
          inst.arguments.add(EventRef.parse(part));
        }
      }
      model.instantiations.add(inst);
    }
  }

  private void parseRequirements(Element parent, ModelSource model) {
    for (Element rEl : children(parent, "Requirement")) {
      ModelSource.Requirement req = new ModelSource.Requirement();
      req.guard = GuardParser.parse(attr(rEl, "guard"));
      GuardParser.Targets targets = GuardParser.parseTargets(attr(rEl, "disables"));
      req.targets.addAll(targets.refs());
      req.setLiteral = targets.setLiteral();
      model.requirements.add(req);
    }
  }

  private Element child(Element parent, String tag) {
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node n = children.item(i);
      if (n instanceof Element && tag.equals(((Element) n).getTagName())) {
        return (Element) n;
      }
    }
    return null;
  }

  private List<Element> children(Element parent, String tag) {
    List<Element> out = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node n = nodes.item(i);
      if (n instanceof Element && tag.equals(((Element) n).getTagName())) {
        out.add((Element) n);
      }
    }
    return out;
  }

  private static boolean flag(Element e, String name) {
    return "true".equals(attr(e, name));
  }

  private static String attrOr(Element e, String name, String def) {
    String v = attr(e, name);
    return (v == null || v.isBlank()) ? def : v;
  }

  private static String attr(Element e, String name) {
    return e.hasAttribute(name) ? e.getAttribute(name).trim() : null;
  }
}
