package org.dxworks.pagecanvas.page;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.pagecanvas.PageCanvasConfig;
import org.dxworks.pagecanvas.codec.AttributeJsonCodec;
import org.dxworks.pagecanvas.markup.MarkupAttributes;
import org.dxworks.pagecanvas.model.CanvasColumn;
import org.dxworks.pagecanvas.model.CanvasControl;
import org.dxworks.pagecanvas.model.CanvasMarkup;
import org.dxworks.pagecanvas.model.CanvasSection;
import org.dxworks.pagecanvas.model.ClientSidePageLayoutType;
import org.dxworks.pagecanvas.model.ClientSideText;
import org.dxworks.pagecanvas.model.ClientSideWebPart;
import org.dxworks.pagecanvas.model.ControlType;
import org.dxworks.pagecanvas.model.PromotedState;
import org.dxworks.pagecanvas.store.PageContent;
import org.dxworks.pagecanvas.store.PageContentStore;
import org.dxworks.pagecanvas.store.PageUpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A "modern" page: the tree of sections, columns and controls held in its canvas markup.
 *
 * <p>The page owns the tree. Sections, columns and controls only exist while reachable from it.
 * Order values are made contiguous by {@link #toHtml()}; mutations in between do not maintain
 * them. A page is not thread safe.
 */
public class ClientSidePage {

    private static final Logger log = LoggerFactory.getLogger(ClientSidePage.class);

    private final PageContentStore store;
    private final String pageRef;
    private final PageCanvasConfig config;
    private final List<CanvasSection> sections = new ArrayList<>();
    private boolean commentsDisabled;
    private ClientSidePageLayoutType layoutType = ClientSidePageLayoutType.ARTICLE;
    private PromotedState promotedState = PromotedState.NOT_PROMOTED;

    /** A page not bound to any store. */
    public ClientSidePage() {
        this(PageCanvasConfig.defaults());
    }

    public ClientSidePage(PageCanvasConfig config) {
        this(null, null, config);
    }

    public ClientSidePage(PageContentStore store, String pageRef, PageCanvasConfig config) {
        this.store = store;
        this.pageRef = pageRef;
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Creates a new, empty page in the store.
     *
     * @throws org.dxworks.pagecanvas.store.PageAlreadyExistsException if the name is taken
     */
    public static ClientSidePage create(PageContentStore store, String pageName, String title,
                                        ClientSidePageLayoutType layoutType) throws IOException {
        return create(store, pageName, title, layoutType, PageCanvasConfig.defaults());
    }

    public static ClientSidePage create(PageContentStore store, String pageName, String title,
                                        ClientSidePageLayoutType layoutType, PageCanvasConfig config) throws IOException {
        Objects.requireNonNull(store, "store");
        PageContent content = store.createPage(pageName, title, layoutType);

        ClientSidePage page = new ClientSidePage(store, pageName, config);
        page.layoutType = layoutType != null ? layoutType : ClientSidePageLayoutType.ARTICLE;
        page.commentsDisabled = content.isCommentsDisabled();
        return page;
    }

    public static ClientSidePage fromStore(PageContentStore store, String pageRef) throws IOException {
        return fromStore(store, pageRef, PageCanvasConfig.defaults());
    }

    public static ClientSidePage fromStore(PageContentStore store, String pageRef, PageCanvasConfig config) throws IOException {
        ClientSidePage page = new ClientSidePage(Objects.requireNonNull(store, "store"), pageRef, config);
        page.load();
        return page;
    }

    public List<CanvasSection> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public String getPageRef() {
        return pageRef;
    }

    public PageCanvasConfig getConfig() {
        return config;
    }

    public boolean isCommentsDisabled() {
        return commentsDisabled;
    }

    public ClientSidePageLayoutType getLayoutType() {
        return layoutType;
    }

    public void setLayoutType(ClientSidePageLayoutType layoutType) {
        this.layoutType = Objects.requireNonNull(layoutType, "layoutType");
    }

    public PromotedState getPromotedState() {
        return promotedState;
    }

    public void setPromotedState(PromotedState promotedState) {
        this.promotedState = Objects.requireNonNull(promotedState, "promotedState");
    }

    public CanvasSection addSection() {
        int next = sections.stream().mapToInt(CanvasSection::getOrder).max().orElse(0) + 1;
        CanvasSection section = new CanvasSection(next, config.getDataVersion());
        sections.add(section);
        return section;
    }

    public boolean removeSection(CanvasSection section) {
        return sections.remove(section);
    }

    /**
     * Renders the page's canvas markup. Reindexes the whole tree first.
     */
    public String toHtml() {
        reindex();

        StringBuilder html = new StringBuilder("<div>");
        for (CanvasSection section : sections) {
            html.append(section.toHtml());
        }
        html.append("</div>");
        return html.toString();
    }

    /**
     * Replaces this page's tree with the one described by {@code html}.
     *
     * @throws org.dxworks.pagecanvas.markup.MalformedMarkupException if the markup is not balanced
     * @throws org.dxworks.pagecanvas.codec.CodecException if control metadata cannot be decoded
     */
    public ClientSidePage fromHtml(String html) {
        sections.clear();

        CanvasTreeReconciler reconciler = new CanvasTreeReconciler(sections, config.getDataVersion());
        List<String> fragments = config.markupScanner().scan(html, CanvasMarkup.CANVAS_CONTROL_BOUNDARY, markup -> markup);

        int counter = 0;
        for (String markup : fragments) {
            JsonNode controlData = AttributeJsonCodec.decode(MarkupAttributes.get(markup, CanvasMarkup.CONTROL_DATA_ATTRIBUTE));
            Optional<ControlType> controlType = ControlType.of(controlData);
            if (controlType.isEmpty()) {
                log.warn("Skipping control of unsupported type {} on page {}", controlData.get("controlType"), pageRef);
                continue;
            }

            CanvasControl control = switch (controlType.get()) {
                case COLUMN -> new CanvasColumn();
                case WEB_PART -> new ClientSideWebPart();
                case TEXT -> new ClientSideText();
            };
            if (!(control instanceof CanvasColumn)) {
                control.setOrder(++counter);
            }
            control.fromHtml(markup, config);
            reconciler.mergeControl(control);
        }

        reconciler.finish();
        log.debug("Parsed {} controls into {} sections", fragments.size(), sections.size());
        return this;
    }

    /**
     * Reads canvas markup and comment setting from the store.
     */
    public void load() throws IOException {
        PageContent content = requireStore().fetchPageContent(pageRef);
        fromHtml(content.getCanvasContent());
        this.commentsDisabled = content.isCommentsDisabled();
        log.debug("Loaded page {}", pageRef);
    }

    /**
     * Writes the rendered canvas markup back to the store.
     */
    public PageUpdateResult save() throws IOException {
        String html = toHtml();
        PageUpdateResult result = requireStore().writePageContent(pageRef, html);
        log.debug("Saved page {} ({} characters)", pageRef, html.length());
        return result;
    }

    public PageUpdateResult enableComments() throws IOException {
        PageUpdateResult result = requireStore().setCommentsDisabled(pageRef, false);
        this.commentsDisabled = false;
        return result;
    }

    public PageUpdateResult disableComments() throws IOException {
        PageUpdateResult result = requireStore().setCommentsDisabled(pageRef, true);
        this.commentsDisabled = true;
        return result;
    }

    public Optional<CanvasControl> findControlById(String id) {
        return findControl(c -> Objects.equals(c.getId(), id));
    }

    /**
     * First control, in document order, accepted by the predicate.
     */
    public Optional<CanvasControl> findControl(Predicate<CanvasControl> predicate) {
        for (CanvasSection section : sections) {
            for (CanvasColumn column : section.getColumns()) {
                for (CanvasControl control : column.getControls()) {
                    if (predicate.test(control)) {
                        return Optional.of(control);
                    }
                }
            }
        }
        return Optional.empty();
    }

    public <T extends CanvasControl> Optional<T> findControl(Class<T> type, Predicate<? super T> predicate) {
        return findControl(c -> type.isInstance(c) && predicate.test(type.cast(c))).map(type::cast);
    }

    private void reindex() {
        for (int i = 0; i < sections.size(); i++) {
            CanvasSection section = sections.get(i);
            section.setOrder(i + 1);
            section.reindex();
        }
    }

    private PageContentStore requireStore() {
        if (store == null) {
            throw new IllegalStateException("Page is not bound to a store");
        }
        return store;
    }
}
