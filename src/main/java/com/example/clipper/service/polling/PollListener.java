package com.example.clipper.service.polling;

import com.example.clipper.dto.RemoteRun;

@FunctionalInterface
public interface PollListener {

    void onProgress(RemoteRun run);

    static PollListener none() {
        return run -> {
        };
    }
}
