package org.zwolang.render;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.zwolang.model.Block;
import org.zwolang.model.Message;
import org.zwolang.model.PowerZone;
import org.zwolang.model.Tag;
import org.zwolang.model.Value;
import org.zwolang.validate.ValidatedWorkout;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ZwoRendererTest {

    private static final ZwoRenderer RENDERER = ZwoRenderer.create(4, "bike");

    private static final Value.Duration THIRTY_SEC = new Value.Duration(30);
    private static final Value PCT_RANGE = new Value.Range(new Value.Percentage(25), new Value.Percentage(50));

    private static final Block META = meta(Map.of());

    @Test
    void render_omitsXmlDeclaration() {
        var text = RENDERER.render(workout(META, List.of()));

        assertFalse(text.startsWith("<?xml"));
        assertThat(text.trim()).startsWith("<workout_file>");
    }

    @Test
    void render_indentsNestedElements() {
        var text = RENDERER.render(workout(META, List.of()));

        assertThat(text).contains("\n    <name>Foo</name>");
    }

    @Test
    void render_metaFieldsBecomeLowercaseElementsInOrder() {
        var root = parse(workout(META, List.of())).getDocumentElement();

        assertThat(childNames(root)).containsExactly("name", "author", "description", "sportType", "workout");
        assertEquals("Foo", child(root, "name").getTextContent());
        assertEquals("sco1", child(root, "author").getTextContent());
        assertEquals("bike", child(root, "sportType").getTextContent());
    }

    @Test
    void render_ftpIsNotWritten() {
        var meta = meta(Map.of(Tag.FTP, new Value.Number(250)));

        var root = parse(new ValidatedWorkout(meta, List.of(), Option.some(250))).getDocumentElement();

        assertThat(childNames(root)).doesNotContain("ftp");
    }

    @Test
    void render_tagsSplitIntoNamedChildren() {
        var meta = meta(Map.of(Tag.TAGS, new Value.Text("#recovery  #zwift\n#z2")));

        var tags = child(parse(workout(meta, List.of())).getDocumentElement(), "tags");

        var names = new ArrayList<String>();
        for (var tag : children(tags)) {
            assertEquals("tag", tag.getTagName());
            names.add(tag.getAttribute("name"));
        }
        assertThat(names).containsExactly("recovery", "zwift", "z2");
    }

    @Test
    void render_customSportType() {
        var root = ZwoRenderer.create(2, "run").document(workout(META, List.of())).getDocumentElement();

        assertEquals("run", child(root, "sportType").getTextContent());
    }

    @Test
    void render_freeRide() {
        var free = block(Tag.FREE, Tag.DURATION, new Value.Duration(666), Tag.CADENCE, new Value.Number(85));

        var element = only(workout(META, List.of(free)));

        assertEquals("FreeRide", element.getTagName());
        assertEquals("666", element.getAttribute("Duration"));
        assertEquals("85", element.getAttribute("Cadence"));
        assertEquals("0", element.getAttribute("FlatRoad"));
    }

    @Test
    void render_freeRideWithoutCadence_leavesAttributeOut() {
        var element = only(workout(META, List.of(block(Tag.FREE, Tag.DURATION, THIRTY_SEC))));

        assertFalse(element.hasAttribute("Cadence"));
    }

    @Test
    void render_steadyStatePercentage() {
        var segment = block(Tag.SEGMENT, Tag.DURATION, THIRTY_SEC, Tag.POWER, new Value.Percentage(65));

        var element = only(workout(META, List.of(segment)));

        assertEquals("SteadyState", element.getTagName());
        assertEquals("30", element.getAttribute("Duration"));
        assertEquals("0.650", element.getAttribute("Power"));
        assertEquals("0", element.getAttribute("pace"));
        assertFalse(element.hasAttribute("PowerLow"));
    }

    @Test
    void render_steadyStateZone() {
        var segment = block(Tag.SEGMENT, Tag.DURATION, THIRTY_SEC, Tag.POWER, PowerZone.SS);

        assertEquals("0.900", only(workout(META, List.of(segment))).getAttribute("Power"));
    }

    @Test
    void render_steadyStateRange_usesLowAndHigh() {
        var segment = block(Tag.SEGMENT, Tag.DURATION, THIRTY_SEC, Tag.POWER, PCT_RANGE);

        var element = only(workout(META, List.of(segment)));

        assertFalse(element.hasAttribute("Power"));
        assertEquals("0.250", element.getAttribute("PowerLow"));
        assertEquals("0.500", element.getAttribute("PowerHigh"));
    }

    @Test
    void render_absoluteWatts_dividedByFtp() {
        var segment = block(Tag.SEGMENT, Tag.DURATION, THIRTY_SEC, Tag.POWER, new Value.Number(150));
        var ramp = block(Tag.RAMP, Tag.DURATION, THIRTY_SEC, Tag.POWER,
                         new Value.Range(new Value.Number(100), new Value.Number(300)));

        var doc = parse(new ValidatedWorkout(META, List.of(segment, ramp), Option.some(200)));
        var elements = children(child(doc.getDocumentElement(), "workout"));

        assertEquals("0.75", elements.get(0).getAttribute("Power"));
        assertEquals("0.5", elements.get(1).getAttribute("PowerLow"));
        assertEquals("1.5", elements.get(1).getAttribute("PowerHigh"));
    }

    @Test
    void render_intervals() {
        var intervals = block(Tag.INTERVALS,
                              Tag.REPEAT, new Value.Number(10),
                              Tag.DURATION, new Value.Range(THIRTY_SEC, new Value.Duration(90)),
                              Tag.POWER, new Value.Range(PowerZone.Z5, PowerZone.Z1),
                              Tag.CADENCE, new Value.Range(new Value.Number(110), new Value.Number(85)));

        var element = only(workout(META, List.of(intervals)));

        assertEquals("IntervalsT", element.getTagName());
        assertEquals("10", element.getAttribute("Repeat"));
        assertEquals("30", element.getAttribute("OnDuration"));
        assertEquals("90", element.getAttribute("OffDuration"));
        assertEquals("1.090", element.getAttribute("OnPower"));
        assertEquals("0.500", element.getAttribute("OffPower"));
        assertEquals("110", element.getAttribute("Cadence"));
        assertEquals("85", element.getAttribute("CadenceResting"));
        assertEquals("0", element.getAttribute("pace"));
    }

    @Test
    void render_rampElementDependsOnPosition() {
        var ramp = block(Tag.RAMP, Tag.DURATION, THIRTY_SEC, Tag.POWER, PCT_RANGE);
        var cooldown = block(Tag.COOLDOWN, Tag.DURATION, THIRTY_SEC, Tag.POWER, PCT_RANGE);
        var warmup = block(Tag.WARMUP, Tag.DURATION, THIRTY_SEC, Tag.POWER, PCT_RANGE);

        var doc = parse(workout(META, List.of(cooldown, warmup, ramp)));

        assertThat(childNames(child(doc.getDocumentElement(), "workout")))
            .containsExactly("WarmUp", "Ramp", "Cooldown");
    }

    @Test
    void render_messagesBecomeTextEvents() {
        var free = new Block(Tag.FREE,
                             Map.of(Tag.DURATION, THIRTY_SEC),
                             List.of(new Message(new Value.Duration(0), "Let's go & \"push\""),
                                     new Message(Value.Duration.of(1, 30), "Halfway")));

        var events = children(only(workout(META, List.of(free))));

        assertThat(events).hasSize(2);
        assertEquals("textevent", events.get(0).getTagName());
        assertEquals("0", events.get(0).getAttribute("timeoffset"));
        assertEquals("Let's go & \"push\"", events.get(0).getAttribute("message"));
        assertEquals("90", events.get(1).getAttribute("timeoffset"));
        assertEquals("Halfway", events.get(1).getAttribute("message"));
    }

    @Test
    void elementName_rejectsNonWorkoutKinds() {
        assertThatThrownBy(() -> ZwoRenderer.elementName(Tag.START_REPEAT, 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // === Helpers ===

    private static Block meta(Map<Tag, Value> extra) {
        var params = new LinkedHashMap<Tag, Value>();
        params.put(Tag.NAME, new Value.Text("Foo"));
        params.put(Tag.AUTHOR, new Value.Text("sco1"));
        params.put(Tag.DESCRIPTION, new Value.Text("d"));
        params.putAll(extra);
        return Block.block(Tag.META, params);
    }

    private static Block block(Tag kind, Object... keysAndValues) {
        var params = new LinkedHashMap<Tag, Value>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            params.put((Tag) keysAndValues[i], (Value) keysAndValues[i + 1]);
        }
        return Block.block(kind, params);
    }

    private static ValidatedWorkout workout(Block meta, List<Block> body) {
        return new ValidatedWorkout(meta, body, Option.none());
    }

    private static Document parse(ValidatedWorkout workout) {
        try {
            var builder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(RENDERER.render(workout))));
        } catch (Exception e) {
            throw new AssertionError("Rendered text is not well-formed", e);
        }
    }

    private static Element only(ValidatedWorkout workout) {
        var blocks = children(child(parse(workout).getDocumentElement(), "workout"));
        assertThat(blocks).hasSize(1);
        return blocks.get(0);
    }

    private static Element child(Element parent, String name) {
        return children(parent).stream()
                               .filter(element -> element.getTagName().equals(name))
                               .findFirst()
                               .orElseThrow(() -> new AssertionError("No <" + name + "> under <" + parent.getTagName() + ">"));
    }

    private static List<Element> children(Element parent) {
        var result = new ArrayList<Element>();
        var nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    private static List<String> childNames(Element parent) {
        return children(parent).stream().map(Element::getTagName).toList();
    }
}
