package com.dronesim.queue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SceneDescriptor {
    private String name;
    private String folder;
    private String glbFile;
    private String path;
}
