package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.pagecanvas.codec.AttributeJsonCodec;
import org.dxworks.pagecanvas.codec.CodecException;
import org.dxworks.pagecanvas.markup.MarkupAttributes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientSideWebPartTest {

    private static final String COMPONENT_ID = "{D1D91016-032F-456D-98A4-721247C305E8}";

    public static class HeroProperties {
        public int layoutCategory;
        public String heading;
    }

    @Test
    void importsComponentDefinition() {
        ClientSideWebPart part = ClientSideWebPart.fromComponentDef(component(
                "{\"webPartData\":{\"properties\":{\"layoutCategory\":2},"
                        + "\"serverProcessedContent\":{\"searchablePlainTexts\":[{\"Name\":\"heading\",\"Value\":\"Welcome\"}]}},"
                        + "\"properties\":{\"ignored\":true}}"));

        assertEquals("D1D91016-032F-456D-98A4-721247C305E8", part.getWebPartId());
        assertEquals("Hero", part.getTitle());
        assertEquals("Shows items", part.getDescription());
        assertEquals(2, part.getPropertiesJson().get("layoutCategory").asInt());
        assertFalse(part.getPropertiesJson().has("ignored"));

        ServerProcessedContent content = part.getServerProcessedContent();
        assertEquals(1, content.searchablePlainTexts.size());
        assertEquals("heading", content.searchablePlainTexts.get(0).name);
        assertEquals("Welcome", content.searchablePlainTexts.get(0).value);
    }

    @Test
    void liftsNestedPropertiesWhenThereIsNoWebPartData() {
        ClientSideWebPart part = ClientSideWebPart.fromComponentDef(component(
                "{\"properties\":{\"heading\":\"Nested\"},\"serverProcessedContent\":{\"links\":{\"url\":\"https://example.org\"}}}"));

        assertEquals("Nested", part.getPropertiesJson().get("heading").asText());
        assertEquals("url", part.getServerProcessedContent().links.get(0).name);
        assertEquals("https://example.org", part.getServerProcessedContent().links.get(0).value);
    }

    @Test
    void usesPreconfiguredPropertiesAsIsOtherwise() {
        ClientSideWebPart part = ClientSideWebPart.fromComponentDef(component("{\"heading\":\"Flat\",\"layoutCategory\":3}"));

        HeroProperties properties = part.getProperties(HeroProperties.class);
        assertEquals("Flat", properties.heading);
        assertEquals(3, properties.layoutCategory);
        assertNull(part.getServerProcessedContent());
    }

    @Test
    void rejectsComponentsWithoutPreconfiguredEntries() {
        ClientSidePageComponent definition = new ClientSidePageComponent(COMPONENT_ID, "{\"preconfiguredEntries\":[]}");

        assertThrows(IllegalArgumentException.class, () -> ClientSideWebPart.fromComponentDef(definition));
        assertThrows(CodecException.class, () -> ClientSideWebPart.fromComponentDef(new ClientSidePageComponent(COMPONENT_ID, null)));
        assertThrows(CodecException.class, () -> ClientSideWebPart.fromComponentDef(new ClientSidePageComponent(COMPONENT_ID, "{nope")));
    }

    @Test
    void typedPropertiesRoundTrip() {
        HeroProperties properties = new HeroProperties();
        properties.heading = "Typed";
        properties.layoutCategory = 4;

        ClientSideWebPart part = new ClientSideWebPart("Hero").setProperties(properties);

        assertEquals("Typed", part.getPropertiesJson().get("heading").asText());
        assertEquals(4, part.getProperties(HeroProperties.class).layoutCategory);
        assertThrows(CodecException.class, () -> new ClientSideWebPart("x")
                .setProperties(Map.of("layoutCategory", "not a number"))
                .getProperties(HeroProperties.class));
    }

    @Test
    void rendersAndReadsBackWebPartData() {
        ClientSideWebPart part = new ClientSideWebPart("Hero", "Shows items", Map.of("layoutCategory", 1), "abc-123");
        part.setId("w1");
        new CanvasSection(1).addControl(part);

        String html = part.toHtml(1);

        assertTrue(html.contains("<div data-sp-componentid>abc-123</div>"));
        assertTrue(html.contains("<div data-sp-htmlproperties=\"\"></div>"));
        JsonNode controlData = AttributeJsonCodec.decode(MarkupAttributes.get(html, "data-sp-controldata"));
        assertEquals(3, controlData.get("controlType").asInt());
        assertEquals("abc-123", controlData.get("webPartId").asText());
        assertEquals(1, controlData.get("position").get("controlIndex").asInt());

        ClientSideWebPart parsed = new ClientSideWebPart();
        parsed.fromHtml(html);

        assertEquals("w1", parsed.getId());
        assertEquals("Hero", parsed.getTitle());
        assertEquals("Shows items", parsed.getDescription());
        assertEquals("abc-123", parsed.getWebPartId());
        assertEquals(1, parsed.getPropertiesJson().get("layoutCategory").asInt());
        assertEquals("", parsed.getHtmlProperties());
    }

    @Test
    void keepsHtmlPropertiesMarkupAcrossRender() {
        ClientSideWebPart part = new ClientSideWebPart("Hero", "", null, "abc");
        new CanvasSection(1).addControl(part);
        String body = "<div data-sp-prop-name=\"title\" data-sp-searchableplaintext=\"true\">Hero</div>";
        String html = part.toHtml(1).replace("<div data-sp-htmlproperties=\"\"></div>",
                "<div data-sp-htmlproperties=\"\">" + body + "</div>");

        ClientSideWebPart parsed = new ClientSideWebPart();
        parsed.fromHtml(html);
        new CanvasSection(1).addControl(parsed);

        assertEquals(body, parsed.getHtmlProperties());
        assertTrue(parsed.toHtml(1).contains("<div data-sp-htmlproperties=\"\">" + body + "</div>"));
    }

    @Test
    void rendersServerProcessedContentAsHtmlProperties() {
        ServerProcessedContent content = new ServerProcessedContent();
        content.searchablePlainTexts = List.of(new ServerProcessedProperty("heading", "Welcome"));
        content.imageSources = List.of(new ServerProcessedProperty("image", "/img/a.png"));
        content.links = List.of(new ServerProcessedProperty("link", "https://example.org"));

        ClientSideWebPart part = new ClientSideWebPart("Hero", "", null, "abc");
        part.setServerProcessedContent(content);
        new CanvasSection(1).addControl(part);

        String html = part.toHtml(1);

        assertTrue(html.contains("<div data-sp-htmlproperties=\"\">"
                + "<div data-sp-prop-name=\"heading\" data-sp-searchableplaintext=\"true\">Welcome</div>"
                + "<img data-sp-prop-name=\"image\" src=\"/img/a.png\" />"
                + "<a data-sp-prop-name=\"link\" href=\"https://example.org\"></a>"
                + "</div>"));

        JsonNode webPartData = AttributeJsonCodec.decode(MarkupAttributes.get(html, "data-sp-webpartdata"));
        assertFalse(webPartData.has("serverProcessedContent"));

        ClientSideWebPart parsed = new ClientSideWebPart();
        parsed.fromHtml(html);
        new CanvasSection(1).addControl(parsed);

        assertNull(parsed.getServerProcessedContent());
        assertEquals(html, parsed.toHtml(1));
    }

    @Test
    void writesHostServerProcessedContentBackUnchanged() {
        ClientSideWebPart part = new ClientSideWebPart("Hero", "", null, "abc");
        part.setId("w1");
        new CanvasSection(1).addControl(part);
        String html = part.toHtml(1);
        String webPartData = MarkupAttributes.get(html, "data-sp-webpartdata");
        ObjectNode hostData = (ObjectNode) AttributeJsonCodec.decode(webPartData);
        hostData.set("serverProcessedContent", AttributeJsonCodec.decode(
                AttributeJsonCodec.encode(Map.of("searchablePlainTexts", Map.of("title", "Hello")))));
        html = html.replace(webPartData, AttributeJsonCodec.encode(hostData));

        ClientSideWebPart parsed = new ClientSideWebPart();
        parsed.fromHtml(html);
        new CanvasSection(1).addControl(parsed);

        assertEquals("Hello", parsed.getServerProcessedContent().searchablePlainTexts.get(0).value);
        String rendered = parsed.toHtml(1);
        assertEquals(hostData, AttributeJsonCodec.decode(MarkupAttributes.get(rendered, "data-sp-webpartdata")));
        assertTrue(rendered.contains("<div data-sp-prop-name=\"title\" data-sp-searchableplaintext=\"true\">Hello</div>"));
    }

    @Test
    void dropsHostServerProcessedContentOnceReplaced() {
        ClientSideWebPart part = new ClientSideWebPart("Hero", "", null, "abc");
        new CanvasSection(1).addControl(part);
        String html = part.toHtml(1);
        String webPartData = MarkupAttributes.get(html, "data-sp-webpartdata");
        ObjectNode hostData = (ObjectNode) AttributeJsonCodec.decode(webPartData);
        hostData.set("serverProcessedContent", AttributeJsonCodec.decode(
                AttributeJsonCodec.encode(Map.of("links", Map.of("url", "https://example.org")))));
        html = html.replace(webPartData, AttributeJsonCodec.encode(hostData));

        ClientSideWebPart parsed = new ClientSideWebPart();
        parsed.fromHtml(html);
        new CanvasSection(1).addControl(parsed);
        ServerProcessedContent replacement = new ServerProcessedContent();
        replacement.links = List.of(new ServerProcessedProperty("url", "https://example.com"));
        parsed.setServerProcessedContent(replacement);

        String rendered = parsed.toHtml(1);
        assertFalse(AttributeJsonCodec.decode(MarkupAttributes.get(rendered, "data-sp-webpartdata")).has("serverProcessedContent"));
        assertTrue(rendered.contains("<a data-sp-prop-name=\"url\" href=\"https://example.com\"></a>"));
    }

    @Test
    void takesDataVersionOfItsColumnUnlessGivenOne() {
        ClientSideWebPart inherited = new ClientSideWebPart("Hero", "", null, "abc");
        ClientSideWebPart pinned = new ClientSideWebPart("Pinned", "", null, "abc", "2.0");
        new CanvasSection(1, "1.4").addControl(inherited).addControl(pinned);

        String html = inherited.toHtml(1);

        assertEquals("1.4", MarkupAttributes.get(html, "data-sp-canvasdataversion"));
        assertEquals("1.4", AttributeJsonCodec.decode(MarkupAttributes.get(html, "data-sp-webpartdata")).get("dataVersion").asText());
        assertEquals("2.0", MarkupAttributes.get(pinned.toHtml(2), "data-sp-canvasdataversion"));
    }

    @Test
    void preservesUnknownWebPartDataKeys() {
        ClientSideWebPart part = new ClientSideWebPart("Hero", "", null, "abc");
        new CanvasSection(1).addControl(part);
        String html = part.toHtml(1);
        String webPartData = MarkupAttributes.get(html, "data-sp-webpartdata");
        JsonNode extended = ((ObjectNode) AttributeJsonCodec.decode(webPartData))
                .put("containsDynamicDataSource", false);
        html = html.replace(webPartData, AttributeJsonCodec.encode(extended));

        ClientSideWebPart parsed = new ClientSideWebPart();
        parsed.fromHtml(html);
        new CanvasSection(1).addControl(parsed);

        JsonNode rendered = AttributeJsonCodec.decode(MarkupAttributes.get(parsed.toHtml(1), "data-sp-webpartdata"));
        assertTrue(rendered.has("containsDynamicDataSource"));
    }

    private static ClientSidePageComponent component(String propertiesJson) {
        String manifest = "{\"id\":\"d1d91016\",\"alias\":\"Hero\",\"preconfiguredEntries\":[{"
                + "\"title\":{\"default\":\"Hero\"},"
                + "\"description\":{\"default\":\"Shows items\"},"
                + "\"groupId\":\"g\","
                + "\"properties\":" + propertiesJson + "}]}";
        ClientSidePageComponent component = new ClientSidePageComponent(COMPONENT_ID, manifest);
        component.name = "Hero";
        return component;
    }
}
