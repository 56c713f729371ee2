package io.tilelite.server.dto;

import java.util.List;

/** JSON response for GET /layers/{name}/{zoom}/tiles. */
public class TilesResponse {
    public String name;
    public int zoom;
    public int count;
    public List<TileView> tiles;
}
