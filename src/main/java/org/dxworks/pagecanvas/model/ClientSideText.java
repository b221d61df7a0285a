package org.dxworks.pagecanvas.model;

import org.dxworks.pagecanvas.PageCanvasConfig;
import org.dxworks.pagecanvas.markup.BoundedMarkupScanner;
import org.dxworks.pagecanvas.markup.MalformedMarkupException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rich text control. Its content is paragraph-wrapped markup.
 */
public final class ClientSideText extends CanvasControl {

    public static final String EDITOR_TYPE = "CKEditor";

    private static final Pattern PARAGRAPH_START = Pattern.compile("^<p[\\s>]", Pattern.CASE_INSENSITIVE);

    private String text = "";

    public ClientSideText() {
        this("");
    }

    public ClientSideText(String text) {
        this(text, null);
    }

    public ClientSideText(String text, String dataVersion) {
        super(ControlType.TEXT, dataVersion);
        setText(text);
    }

    public String getText() {
        return text;
    }

    /**
     * Sets the text markup, wrapping it in {@code <p>} unless it already starts with a paragraph.
     */
    public void setText(String text) {
        if (text == null || text.isEmpty()) {
            this.text = "";
            return;
        }
        this.text = PARAGRAPH_START.matcher(text).find() ? text : "<p>" + text + "</p>";
    }

    @Override
    public String toHtml(int index) {
        this.order = index;

        return CanvasMarkup.controlDiv(getDataVersion(), getJsonData())
                + "<div " + CanvasMarkup.RTE_ATTRIBUTE + "=\"\">"
                + text
                + "</div>"
                + "</div>";
    }

    @Override
    public void fromHtml(String html, PageCanvasConfig config) {
        super.fromHtml(html, config);

        BoundedMarkupScanner scanner = config.markupScanner();
        Optional<String> content = scanner.scanFirst(html, CanvasMarkup.RTE_BOUNDARY, scanner::innerMarkup);

        if (content.isPresent()) {
            setText(content.get());
        } else if (config.isStrictTextContent()) {
            throw new MalformedMarkupException("Text control " + id + " has no " + CanvasMarkup.RTE_ATTRIBUTE + " content holder");
        } else {
            this.text = "";
        }
    }

    @Override
    protected ClientSideControlData buildControlData() {
        ClientSideControlData data = newControlData();
        data.controlType = getControlType().getValue();
        data.editorType = EDITOR_TYPE;
        data.id = id;
        data.position = positionInColumn();
        return data;
    }
}
