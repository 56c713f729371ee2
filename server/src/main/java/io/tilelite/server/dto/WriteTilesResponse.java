package io.tilelite.server.dto;

/** JSON response for PUT /layers/{name}/{zoom}/tiles. */
public class WriteTilesResponse {
    public boolean ok;
    public int count;
    public long generation;
    public String indexType;
}
