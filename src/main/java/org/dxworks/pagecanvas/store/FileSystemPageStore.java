package org.dxworks.pagecanvas.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.pagecanvas.model.ClientSidePageLayoutType;
import org.dxworks.pagecanvas.model.PromotedState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Keeps page items as JSON documents in a directory, one {@code <pageName>.json} per page.
 * Methods are synchronized so one store can back several pages.
 */
public class FileSystemPageStore implements PageContentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemPageStore.class);

    private static final String ITEM_SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public FileSystemPageStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized PageContent createPage(String pageName, String title, ClientSidePageLayoutType layoutType) throws IOException {
        Path itemPath = itemPath(pageName);
        if (Files.exists(itemPath)) {
            throw new PageAlreadyExistsException(pageName, directory.toString());
        }

        PageItem item = new PageItem();
        item.title = title;
        item.bannerImageUrl = new PageItem.Url(PageItem.BANNER_IMAGE_URL);
        item.canvasContent1 = "";
        item.clientSideApplicationId = PageItem.CLIENT_SIDE_APPLICATION_ID;
        item.contentTypeId = PageItem.CONTENT_TYPE_ID;
        item.pageLayoutType = (layoutType != null ? layoutType : ClientSidePageLayoutType.ARTICLE).getValue();
        item.promotedState = PromotedState.NOT_PROMOTED.getValue();
        item.commentsDisabled = false;
        item.version = 1;

        Files.createDirectories(directory);
        writeItem(itemPath, item);
        log.debug("Created page {} in {}", pageName, directory);

        return new PageContent(pageName, item.canvasContent1, item.commentsDisabled);
    }

    @Override
    public synchronized PageContent fetchPageContent(String pageRef) throws IOException {
        PageItem item = readItem(itemPath(pageRef));
        return new PageContent(pageRef, item.canvasContent1, item.commentsDisabled);
    }

    @Override
    public synchronized PageUpdateResult writePageContent(String pageRef, String canvasContent) throws IOException {
        Path itemPath = itemPath(pageRef);
        PageItem item = readItem(itemPath);
        item.canvasContent1 = canvasContent == null ? "" : canvasContent;
        item.version++;
        writeItem(itemPath, item);
        log.debug("Wrote {} characters of canvas content to {}", item.canvasContent1.length(), pageRef);

        return new PageUpdateResult(pageRef, List.of("CanvasContent1"), eTag(item));
    }

    @Override
    public synchronized PageUpdateResult setCommentsDisabled(String pageRef, boolean disabled) throws IOException {
        Path itemPath = itemPath(pageRef);
        PageItem item = readItem(itemPath);
        item.commentsDisabled = disabled;
        item.version++;
        writeItem(itemPath, item);

        return new PageUpdateResult(pageRef, List.of("CommentsDisabled"), eTag(item));
    }

    private Path itemPath(String pageName) {
        if (pageName == null || pageName.isBlank()) {
            throw new IllegalArgumentException("Page name must not be blank");
        }
        if (pageName.contains("/") || pageName.contains("\\") || pageName.equals(".") || pageName.equals("..")) {
            throw new IllegalArgumentException("Page name must not contain path separators: " + pageName);
        }
        return directory.resolve(pageName + ITEM_SUFFIX);
    }

    private PageItem readItem(Path itemPath) throws IOException {
        if (!Files.exists(itemPath)) {
            throw new NoSuchFileException(itemPath.toString(), null, "page does not exist");
        }
        return mapper.readValue(itemPath.toFile(), PageItem.class);
    }

    private void writeItem(Path itemPath, PageItem item) throws IOException {
        Path temp = itemPath.resolveSibling(itemPath.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), item);
        Files.move(temp, itemPath, StandardCopyOption.REPLACE_EXISTING);
    }

    private static String eTag(PageItem item) {
        return "\"" + item.version + "\"";
    }
}
