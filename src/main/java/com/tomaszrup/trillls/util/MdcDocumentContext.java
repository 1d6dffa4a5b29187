////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.trillls.util;

import org.slf4j.MDC;

import java.net.URI;
import java.util.Map;

/**
 * Manages the SLF4J MDC (Mapped Diagnostic Context) key {@code "document"} so
 * that every log line written while handling a document names it.
 *
 * <p>The label is the file name of the document URI (e.g. {@code main.groovy}),
 * falling back to the full URI for URIs without a path.</p>
 *
 * <h3>Usage at entry points (LSP handlers, thread pool tasks):</h3>
 * <pre>{@code
 * MdcDocumentContext.setDocument(uri);
 * try {
 *     // ... all log calls inside here will include [main.groovy]
 * } finally {
 *     MdcDocumentContext.clear();
 * }
 * }</pre>
 *
 * <h3>MDC propagation across threads:</h3>
 * <p>Use {@link #wrap(Runnable)} to capture the current MDC context and
 * restore it in the target thread.</p>
 */
public final class MdcDocumentContext {

    /** MDC key used in the logback pattern via {@code %X{document}}. */
    public static final String MDC_KEY = "document";

    private MdcDocumentContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "document"} key for the given document.
     *
     * @param uri the document URI; {@code null} clears the key
     */
    public static void setDocument(URI uri) {
        if (uri == null) {
            clear();
            return;
        }
        MDC.put(MDC_KEY, label(uri));
    }

    static String label(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty()) {
            return uri.toString();
        }
        int slash = path.lastIndexOf('/');
        String fileName = slash >= 0 ? path.substring(slash + 1) : path;
        return fileName.isEmpty() ? uri.toString() : fileName;
    }

    /**
     * Removes the MDC {@code "document"} key from the current thread.
     */
    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Returns a snapshot of the current thread's MDC context map.
     *
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the current thread's MDC context is
     * captured and restored in the executing thread. After the task completes,
     * the executing thread's MDC is restored to its previous state.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }
}
