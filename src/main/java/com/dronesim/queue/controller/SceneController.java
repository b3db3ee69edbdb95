package com.dronesim.queue.controller;

import com.dronesim.queue.model.SceneDescriptor;
import com.dronesim.queue.service.SceneCatalogService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class SceneController {

    @Autowired
    private SceneCatalogService sceneCatalog;

    @GetMapping("/models")
    public ResponseEntity<List<SceneDescriptor>> listModels() {
        return ResponseEntity.ok(sceneCatalog.listScenes());
    }
}
