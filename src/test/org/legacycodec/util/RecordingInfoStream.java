package org.legacycodec.util;

/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An {@link InfoStream} that keeps every message, for tests asserting
 * on what a component reports.
 */
public class RecordingInfoStream extends InfoStream {
  private final List<String> messages = Collections.synchronizedList(new ArrayList<String>());

  @Override
  public void message(String component, String message) {
    messages.add(component + ": " + message);
  }

  @Override
  public boolean isEnabled(String component) {
    return true;
  }

  /** Messages of the given component, without the component prefix. */
  public List<String> getMessages(String component) {
    final String prefix = component + ": ";
    final List<String> result = new ArrayList<String>();
    synchronized (messages) {
      for (String m : messages) {
        if (m.startsWith(prefix)) {
          result.add(m.substring(prefix.length()));
        }
      }
    }
    return result;
  }

  @Override
  public void close() {
    messages.clear();
  }
}
