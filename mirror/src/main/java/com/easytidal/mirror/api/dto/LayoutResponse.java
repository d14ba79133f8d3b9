package com.easytidal.mirror.api.dto;

import com.easytidal.mirror.graph.Edge;
import com.easytidal.mirror.layout.Point;
import com.easytidal.mirror.service.DataSource;

import java.util.List;
import java.util.Map;

/**
 * Response body for GET /api/layout: everything a client needs to draw the
 * left-to-right dependency chart itself.
 */
public record LayoutResponse(
        Map<String, Integer> levels,
        Map<String, Point>   positions,
        List<Edge>           edges,
        DataSource           dataSource
) {}
