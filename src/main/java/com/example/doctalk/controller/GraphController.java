package com.example.doctalk.controller;

import com.example.doctalk.model.GraphView;
import com.example.doctalk.model.NodeDetails;
import com.example.doctalk.service.GraphService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "graph")
@RestController
@RequestMapping("/api/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphService graphService;

    @GetMapping
    public GraphView getGraph(@RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader) {
        return graphService.getGraph(CurrentUser.require(userHeader));
    }

    @GetMapping("/nodes/{nodeId}")
    public NodeDetails getNode(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader,
            @PathVariable String nodeId) {
        return graphService.getNode(CurrentUser.require(userHeader), nodeId);
    }
}
