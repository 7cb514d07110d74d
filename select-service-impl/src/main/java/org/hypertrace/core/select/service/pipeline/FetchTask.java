package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;

@FunctionalInterface
public interface FetchTask {
  void fetch(FragmentEmitter emitter) throws IOException;
}
