package io.tilelite.server.dto;

/** One entry of GET /layers. */
public class LayerIdView {
    public String name;
    public int zoom;
}
