package com.dronesim.queue.service;

@FunctionalInterface
public interface ProgressListener {

    /**
     * @param percent completion in {@code [0, 100]}
     */
    void onProgress(int percent);
}
