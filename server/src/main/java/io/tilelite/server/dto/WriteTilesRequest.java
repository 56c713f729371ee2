package io.tilelite.server.dto;

import java.util.List;

/**
 * JSON request body for PUT /layers/{name}/{zoom}/tiles.
 *   {
 *     "indexMethod": "hilbert",          // optional, server default otherwise
 *     "tiles": [ {"col": 0, "row": 0, "cols": 2, "rows": 2, "cells": [1, 2, 3, 4]} ]
 *   }
 */
public class WriteTilesRequest {
    public String indexMethod;
    public List<TileView> tiles;
}
