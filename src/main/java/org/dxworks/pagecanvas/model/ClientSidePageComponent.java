package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.pagecanvas.codec.AttributeJsonCodec;
import org.dxworks.pagecanvas.codec.CodecException;

import java.io.IOException;

/**
 * A web part available to pages, as listed by the host. {@code Manifest} is a JSON document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSidePageComponent {
    @JsonProperty("ComponentType")
    public int componentType;
    @JsonProperty("Id")
    public String id;
    @JsonProperty("Manifest")
    public String manifest;
    @JsonProperty("ManifestType")
    public int manifestType;
    @JsonProperty("Name")
    public String name;
    @JsonProperty("Status")
    public int status;

    public ClientSidePageComponent() {
    }

    public ClientSidePageComponent(String id, String manifest) {
        this.id = id;
        this.manifest = manifest;
    }

    public ClientSidePageComponentManifest parseManifest() {
        if (manifest == null) {
            throw new CodecException("Component " + id + " has no manifest");
        }
        try {
            return AttributeJsonCodec.mapper().readValue(manifest, ClientSidePageComponentManifest.class);
        } catch (IOException e) {
            throw new CodecException("Manifest of component " + id + " is not valid JSON", e);
        }
    }
}
