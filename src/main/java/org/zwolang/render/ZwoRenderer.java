package org.zwolang.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.zwolang.model.Block;
import org.zwolang.model.Message;
import org.zwolang.model.Tag;
import org.zwolang.validate.ValidatedWorkout;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.List;

/**
 * Renders a validated workout as a ZWO document.
 *
 * <p>The root {@code workout_file} holds one element per META field (FTP excluded), the fixed
 * {@code sportType} trailer, and the {@code workout} container with one element per body block.
 * The serialized text has no XML declaration.
 */
public final class ZwoRenderer {
    private static final Logger log = LoggerFactory.getLogger(ZwoRenderer.class);

    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private final int indent;
    private final String sportType;

    private ZwoRenderer(int indent, String sportType) {
        this.indent = indent;
        this.sportType = sportType;
    }

    public static ZwoRenderer create(int indent, String sportType) {
        return new ZwoRenderer(indent, sportType);
    }

    /**
     * Render to pretty-printed markup text.
     */
    public String render(ValidatedWorkout workout) {
        return serialize(document(workout));
    }

    /**
     * Build the markup tree.
     */
    public Document document(ValidatedWorkout workout) {
        var doc = newDocument();
        var root = doc.createElement("workout_file");
        doc.appendChild(root);

        appendMeta(doc, root, workout.meta());
        appendWorkout(doc, root, workout.body(), new PowerFormat(workout.ftp()));
        return doc;
    }

    private void appendMeta(Document doc, Element root, Block meta) {
        meta.params().forEach((key, value) -> {
            if (key == Tag.FTP) {
                return;
            }
            var element = doc.createElement(key.elementName());
            if (key == Tag.TAGS) {
                for (var hashtag : value.format().trim().split("\\s+")) {
                    if (hashtag.isEmpty()) {
                        continue;
                    }
                    var tag = doc.createElement("tag");
                    tag.setAttribute("name", stripMarker(hashtag));
                    element.appendChild(tag);
                }
            } else {
                element.appendChild(doc.createTextNode(value.format()));
            }
            root.appendChild(element);
        });

        var trailer = doc.createElement("sportType");
        trailer.appendChild(doc.createTextNode(sportType));
        root.appendChild(trailer);
    }

    private static String stripMarker(String hashtag) {
        int start = 0;
        while (start < hashtag.length() && hashtag.charAt(start) == '#') {
            start++;
        }
        return hashtag.substring(start);
    }

    private void appendWorkout(Document doc, Element root, List<Block> body, PowerFormat power) {
        var workout = doc.createElement("workout");
        root.appendChild(workout);

        int position = 1;
        for (var block : body) {
            workout.appendChild(blockElement(doc, block, position, body.size(), power));
            position++;
        }
        log.debug("Rendered {} block element(s)", body.size());
    }

    private Element blockElement(Document doc, Block block, int position, int total, PowerFormat power) {
        var element = doc.createElement(elementName(block.kind(), position, total));

        for (var attribute : BlockLayout.forKind(block.kind()).attributes()) {
            attribute.source()
                     .valueOf(block, power)
                     .forEach(text -> element.setAttribute(attribute.name(), text));
        }
        for (var message : block.messages()) {
            element.appendChild(textEvent(doc, message));
        }
        return element;
    }

    static String elementName(Tag kind, int position, int total) {
        if (kind == Tag.FREE) {
            return "FreeRide";
        }
        if (kind == Tag.SEGMENT) {
            return "SteadyState";
        }
        if (kind == Tag.INTERVALS) {
            return "IntervalsT";
        }
        if (kind.isRampLike()) {
            return RampPosition.classify(position, total).elementName();
        }
        throw new IllegalArgumentException("Block kind " + kind + " has no workout element");
    }

    private static Element textEvent(Document doc, Message message) {
        var event = doc.createElement("textevent");
        event.setAttribute("timeoffset", message.timestamp().format());
        event.setAttribute("message", message.text());
        return event;
    }

    // === Serialization ===

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance()
                                         .newDocumentBuilder()
                                         .newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder unavailable", e);
        }
    }

    private String serialize(Document doc) {
        try {
            var writer = new StringWriter();
            newTransformer().transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Unable to serialize ZWO document", e);
        }
    }

    private Transformer newTransformer() throws TransformerException {
        var transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty(INDENT_AMOUNT, Integer.toString(indent));
        return transformer;
    }
}
