package org.dxworks.pagecanvas.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * List item fields of a page as stored by {@link FileSystemPageStore}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class PageItem {
    static final String BANNER_IMAGE_URL = "/_layouts/15/images/sitepagethumbnail.png";
    static final String CLIENT_SIDE_APPLICATION_ID = "b6917cb1-93a0-4b97-a84d-7cf49975d4ec";
    static final String CONTENT_TYPE_ID = "0x0101009D1CB255DA76424F860D91F20E6C4118";

    @JsonProperty("Title")
    public String title;
    @JsonProperty("BannerImageUrl")
    public Url bannerImageUrl;
    @JsonProperty("CanvasContent1")
    public String canvasContent1 = "";
    @JsonProperty("ClientSideApplicationId")
    public String clientSideApplicationId;
    @JsonProperty("ContentTypeId")
    public String contentTypeId;
    @JsonProperty("PageLayoutType")
    public String pageLayoutType;
    @JsonProperty("PromotedState")
    public int promotedState;
    @JsonProperty("CommentsDisabled")
    public boolean commentsDisabled;
    @JsonProperty("Version")
    public int version;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Url {
        @JsonProperty("Url")
        public String url;

        Url() {
        }

        Url(String url) {
            this.url = url;
        }
    }
}
