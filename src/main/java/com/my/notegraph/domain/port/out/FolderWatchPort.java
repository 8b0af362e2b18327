package com.my.notegraph.domain.port.out;

import java.util.List;

public interface FolderWatchPort {

    void watch(List<String> roots);

    void stop();
}
