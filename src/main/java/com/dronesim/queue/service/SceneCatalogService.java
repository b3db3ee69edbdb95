package com.dronesim.queue.service;

import com.dronesim.queue.model.SceneDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Lists the 3D scenes available to simulations: every folder under the models root
 * that holds a {@code .glb} file.
 */
@Slf4j
@Service
public class SceneCatalogService {

    static final String URL_PREFIX = "/3d_models/";

    @Value("${simulation.models.path:3d_models}")
    private String modelsPath;

    public void setModelsPath(String path) {
        this.modelsPath = path;
    }

    public List<SceneDescriptor> listScenes() {
        File root = new File(modelsPath);
        if (!root.isDirectory()) {
            log.debug("Models directory not found: {}", modelsPath);
            return List.of();
        }

        File[] folders = root.listFiles(File::isDirectory);
        if (folders == null) return List.of();

        List<SceneDescriptor> scenes = new ArrayList<>();
        for (File folder : folders) {
            String[] glbFiles = folder.list((dir, name) -> name.endsWith(".glb"));
            if (glbFiles == null || glbFiles.length == 0) {
                continue;
            }
            Arrays.sort(glbFiles);
            scenes.add(SceneDescriptor.builder()
                .name(folder.getName())
                .folder(folder.getName())
                .glbFile(glbFiles[0])
                .path(URL_PREFIX + folder.getName() + "/" + glbFiles[0])
                .build());
        }
        scenes.sort(Comparator.comparing(SceneDescriptor::getName));
        return scenes;
    }
}
