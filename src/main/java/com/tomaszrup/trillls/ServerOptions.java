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
package com.tomaszrup.trillls;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.tomaszrup.trillls.core.ClosePolicy;
import com.tomaszrup.trillls.core.ColumnEncoding;
import com.tomaszrup.trillls.language.LanguageKind;

/**
 * Command line options of the server.
 *
 * <pre>
 * [--tcp [port]] [--language groovy|catalog] [--catalog file]
 * [--close-policy remove|retain] [--column-encoding utf16|codepoint]
 * </pre>
 *
 * Without {@code --tcp} the server talks JSON-RPC over stdin/stdout.
 */
public final class ServerOptions {

    public static final int DEFAULT_TCP_PORT = 5007;

    private boolean tcp;
    private int port = DEFAULT_TCP_PORT;
    private LanguageKind language = LanguageKind.GROOVY;
    private Path catalogFile;
    private ClosePolicy closePolicy = ClosePolicy.REMOVE;
    private ColumnEncoding columnEncoding = ColumnEncoding.UTF16;

    private ServerOptions() {
    }

    /**
     * @throws IllegalArgumentException for unknown options, missing option
     *         values, or values that cannot be parsed
     */
    public static ServerOptions parse(String[] args) {
        ServerOptions options = new ServerOptions();
        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            switch (arg) {
                case "--tcp":
                    options.tcp = true;
                    if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        options.port = parsePort(args[++i]);
                    }
                    break;
                case "--language":
                    options.language = LanguageKind.fromString(requireValue(args, ++i, arg));
                    break;
                case "--catalog":
                    options.catalogFile = Paths.get(requireValue(args, ++i, arg));
                    break;
                case "--close-policy":
                    options.closePolicy = ClosePolicy.fromString(requireValue(args, ++i, arg));
                    break;
                case "--column-encoding":
                    options.columnEncoding = ColumnEncoding.fromString(requireValue(args, ++i, arg));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
            i++;
        }
        if (options.catalogFile != null && options.language != LanguageKind.CATALOG) {
            throw new IllegalArgumentException("--catalog requires --language catalog");
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port number: " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port number: " + value);
        }
        return port;
    }

    public boolean isTcp() {
        return tcp;
    }

    public int getPort() {
        return port;
    }

    public LanguageKind getLanguage() {
        return language;
    }

    /** The catalog file given on the command line, or {@code null}. */
    public Path getCatalogFile() {
        return catalogFile;
    }

    public ClosePolicy getClosePolicy() {
        return closePolicy;
    }

    public ColumnEncoding getColumnEncoding() {
        return columnEncoding;
    }
}
