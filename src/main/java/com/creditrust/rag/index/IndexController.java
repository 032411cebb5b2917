package com.creditrust.rag.index;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status and maintenance endpoints of the vector index.
 */
@RestController
@RequestMapping(path = "/api/index", produces = MediaType.APPLICATION_JSON_VALUE)
public class IndexController {

    private final IndexRegistry registry;
    private final IndexBuilder builder;

    public IndexController(IndexRegistry registry, IndexBuilder builder) {
        this.registry = registry;
        this.builder = builder;
    }

    @GetMapping
    public IndexStatus status() {
        return registry.describe();
    }

    @PostMapping("/rebuild")
    public IndexBuildReport rebuild() {
        return builder.rebuildFromSource();
    }
}
