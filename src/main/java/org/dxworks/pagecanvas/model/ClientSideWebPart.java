package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.pagecanvas.PageCanvasConfig;
import org.dxworks.pagecanvas.codec.AttributeJsonCodec;
import org.dxworks.pagecanvas.codec.CodecException;
import org.dxworks.pagecanvas.markup.BoundedMarkupScanner;
import org.dxworks.pagecanvas.markup.MarkupAttributes;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A web part placed on the canvas: a component id, title, description and a free-form property
 * bag, plus the pre-rendered html properties the host keeps next to it.
 */
public final class ClientSideWebPart extends CanvasControl {

    private static final Pattern SURROUNDING_BRACES = Pattern.compile("^\\{|}$");

    private String title;
    private String description;
    private JsonNode properties;
    private String webPartId;
    private String htmlProperties = "";
    private ServerProcessedContent serverProcessedContent;
    private ClientSideWebPartData webPartData;

    public ClientSideWebPart() {
        this("");
    }

    public ClientSideWebPart(String title) {
        this(title, "", null, "");
    }

    public ClientSideWebPart(String title, String description, Object properties, String webPartId) {
        this(title, description, properties, webPartId, null);
    }

    public ClientSideWebPart(String title, String description, Object properties, String webPartId, String dataVersion) {
        super(ControlType.WEB_PART, dataVersion);
        this.title = title;
        this.description = description;
        this.webPartId = webPartId;
        setProperties(properties);
    }

    /**
     * Creates a web part initialized from a component the host offers.
     */
    public static ClientSideWebPart fromComponentDef(ClientSidePageComponent definition) {
        ClientSideWebPart part = new ClientSideWebPart();
        part.importComponent(definition);
        return part;
    }

    /**
     * Takes id, title, description and default properties from a component definition. The
     * defaults come from the first preconfigured entry of the component's manifest.
     */
    public void importComponent(ClientSidePageComponent component) {
        if (component.id == null) {
            throw new IllegalArgumentException("Component definition has no id");
        }
        this.webPartId = SURROUNDING_BRACES.matcher(component.id.trim()).replaceAll("");

        ClientSidePageComponentManifest.PreconfiguredEntry entry = component.parseManifest()
                .firstPreconfiguredEntry()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Manifest of component " + webPartId + " has no preconfigured entries"));

        this.title = ClientSidePageComponentManifest.LocalizedString.valueOf(entry.title);
        this.description = ClientSidePageComponentManifest.LocalizedString.valueOf(entry.description);
        this.properties = parseJsonProperties(entry.properties);
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getWebPartId() {
        return webPartId;
    }

    public void setWebPartId(String webPartId) {
        this.webPartId = webPartId;
    }

    public JsonNode getPropertiesJson() {
        return properties;
    }

    public <T> T getProperties(Class<T> type) {
        try {
            return AttributeJsonCodec.mapper().treeToValue(properties, type);
        } catch (JsonProcessingException e) {
            throw new CodecException("Properties of web part " + id + " do not describe a " + type.getSimpleName(), e);
        }
    }

    public ClientSideWebPart setProperties(Object properties) {
        ObjectMapper mapper = AttributeJsonCodec.mapper();
        if (properties == null) {
            this.properties = mapper.createObjectNode();
        } else if (properties instanceof JsonNode node) {
            this.properties = node.deepCopy();
        } else {
            this.properties = mapper.valueToTree(properties);
        }
        return this;
    }

    /** Raw html properties markup kept from the last parse. */
    public String getHtmlProperties() {
        return htmlProperties;
    }

    public ServerProcessedContent getServerProcessedContent() {
        return serverProcessedContent;
    }

    /**
     * Replaces the server processed content. It is rendered into the html properties only; the
     * host's own copy in the web part data is dropped.
     */
    public void setServerProcessedContent(ServerProcessedContent serverProcessedContent) {
        this.serverProcessedContent = serverProcessedContent;
        if (webPartData != null) {
            webPartData.serverProcessedContent = null;
        }
    }

    @Override
    public String toHtml(int index) {
        this.order = index;
        String dataVersion = getDataVersion();

        StringBuilder html = new StringBuilder();
        html.append(CanvasMarkup.controlDiv(dataVersion, getJsonData()));

        html.append("<div ").append(CanvasMarkup.WEB_PART_ATTRIBUTE).append("=\"\" ")
                .append(CanvasMarkup.DATA_VERSION_ATTRIBUTE).append("=\"").append(dataVersion).append("\" ")
                .append(CanvasMarkup.WEB_PART_DATA_ATTRIBUTE).append("=\"")
                .append(AttributeJsonCodec.encode(buildWebPartData())).append("\">");

        html.append("<div ").append(CanvasMarkup.COMPONENT_ID_ATTRIBUTE).append(">");
        html.append(nullToEmpty(webPartId));
        html.append("</div>");

        html.append("<div ").append(CanvasMarkup.HTML_PROPERTIES_ATTRIBUTE).append("=\"\">");
        html.append(renderHtmlProperties());
        html.append("</div>");

        html.append("</div>");
        html.append("</div>");

        return html.toString();
    }

    @Override
    public void fromHtml(String html, PageCanvasConfig config) {
        super.fromHtml(html, config);

        ClientSideWebPartData data = AttributeJsonCodec.decode(
                MarkupAttributes.get(html, CanvasMarkup.WEB_PART_DATA_ATTRIBUTE), ClientSideWebPartData.class);

        this.webPartData = data;
        this.title = data.title;
        this.description = data.description;
        this.webPartId = data.id;
        setProperties(data.properties);
        if (controlData.id == null && data.instanceId != null) {
            this.id = data.instanceId;
        }
        if (data.serverProcessedContent != null && !data.serverProcessedContent.isNull()) {
            this.serverProcessedContent = toServerProcessedContent(data.serverProcessedContent);
        }

        BoundedMarkupScanner scanner = config.markupScanner();
        this.htmlProperties = scanner
                .scanFirst(html, CanvasMarkup.HTML_PROPERTIES_BOUNDARY, scanner::innerMarkup)
                .orElse("");
    }

    @Override
    protected ClientSideControlData buildControlData() {
        ClientSideControlData data = newControlData();
        data.controlType = getControlType().getValue();
        data.id = id;
        data.position = positionInColumn();
        data.webPartId = webPartId;
        return data;
    }

    private ClientSideWebPartData buildWebPartData() {
        ClientSideWebPartData data = new ClientSideWebPartData();
        if (webPartData != null) {
            data.getAdditionalProperties().putAll(webPartData.getAdditionalProperties());
        }
        data.dataVersion = getDataVersion();
        data.description = nullToEmpty(description);
        data.id = nullToEmpty(webPartId);
        data.instanceId = id;
        data.properties = properties;
        // only the host's own value is written back
        data.serverProcessedContent = webPartData != null ? webPartData.serverProcessedContent : null;
        data.title = nullToEmpty(title);
        return data;
    }

    /**
     * Body of the html properties holder: the markup kept from the last parse, or markup
     * generated from the server processed content when there is any.
     */
    private String renderHtmlProperties() {
        if (serverProcessedContent == null) {
            return htmlProperties;
        }

        StringBuilder html = new StringBuilder();
        for (ServerProcessedProperty prop : nullToEmpty(serverProcessedContent.searchablePlainTexts)) {
            html.append("<div ").append(CanvasMarkup.PROP_NAME_ATTRIBUTE).append("=\"").append(prop.name).append("\" ")
                    .append(CanvasMarkup.SEARCHABLE_PLAIN_TEXT_ATTRIBUTE).append("=\"true\">")
                    .append(nullToEmpty(prop.value))
                    .append("</div>");
        }
        for (ServerProcessedProperty prop : nullToEmpty(serverProcessedContent.imageSources)) {
            html.append("<img ").append(CanvasMarkup.PROP_NAME_ATTRIBUTE).append("=\"").append(prop.name)
                    .append("\" src=\"").append(nullToEmpty(prop.value)).append("\" />");
        }
        for (ServerProcessedProperty prop : nullToEmpty(serverProcessedContent.links)) {
            html.append("<a ").append(CanvasMarkup.PROP_NAME_ATTRIBUTE).append("=\"").append(prop.name)
                    .append("\" href=\"").append(nullToEmpty(prop.value)).append("\"></a>");
        }
        return html.toString();
    }

    /**
     * Picks the effective property bag out of a manifest's preconfigured properties and captures
     * any server processed content found next to it.
     */
    private JsonNode parseJsonProperties(JsonNode props) {
        if (props == null || props.isNull() || props.isMissingNode()) {
            this.serverProcessedContent = null;
            return AttributeJsonCodec.mapper().createObjectNode();
        }

        JsonNode webPartDataNode = props.get("webPartData");
        if (webPartDataNode != null && webPartDataNode.has("serverProcessedContent")) {
            this.serverProcessedContent = toServerProcessedContent(webPartDataNode.get("serverProcessedContent"));
        } else if (props.has("serverProcessedContent")) {
            this.serverProcessedContent = toServerProcessedContent(props.get("serverProcessedContent"));
        } else {
            this.serverProcessedContent = null;
        }

        if (webPartDataNode != null && webPartDataNode.has("properties")) {
            return webPartDataNode.get("properties");
        } else if (props.has("properties")) {
            return props.get("properties");
        } else {
            return props;
        }
    }

    private ServerProcessedContent toServerProcessedContent(JsonNode node) {
        try {
            return AttributeJsonCodec.mapper().treeToValue(node, ServerProcessedContent.class);
        } catch (JsonProcessingException e) {
            throw new CodecException("Server processed content of component " + webPartId + " is malformed", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
