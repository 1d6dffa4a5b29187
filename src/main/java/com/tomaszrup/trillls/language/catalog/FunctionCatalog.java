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
package com.tomaszrup.trillls.language.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.tomaszrup.trillls.language.FunctionDoc;
import com.tomaszrup.trillls.language.FunctionSignature;

/**
 * An immutable table of documented functions grouped by namespace, read from
 * a JSON file of the form:
 *
 * <pre>
 * {
 *   "language": "tremor",
 *   "separator": "::",
 *   "namespaces": {
 *     "std::string": [
 *       { "name": "len", "args": ["s"], "description": "Returns the length of `s`." }
 *     ]
 *   }
 * }
 * </pre>
 *
 * <p>Namespace and function order is preserved from the file.</p>
 */
public final class FunctionCatalog {

    private static final Logger logger = LoggerFactory.getLogger(FunctionCatalog.class);

    /** Classpath location of the catalog shipped with the server. */
    public static final String BUNDLED_RESOURCE = "/catalog/std.json";

    static final String DEFAULT_SEPARATOR = "::";

    private static final Gson GSON = new Gson();

    private final String language;
    private final String separator;
    private final Map<String, List<FunctionDoc>> namespaces;
    private final Map<String, FunctionDoc> byQualifiedName;

    private FunctionCatalog(String language, String separator, Map<String, List<FunctionDoc>> namespaces) {
        this.language = language;
        this.separator = separator;
        this.namespaces = namespaces;
        Map<String, FunctionDoc> index = new LinkedHashMap<>();
        for (Map.Entry<String, List<FunctionDoc>> entry : namespaces.entrySet()) {
            for (FunctionDoc doc : entry.getValue()) {
                index.putIfAbsent(entry.getKey() + separator + doc.getSignature().getName(), doc);
            }
        }
        this.byQualifiedName = Collections.unmodifiableMap(index);
    }

    // ---- Serialized model ----

    static class CatalogFile {
        String language;
        String separator;
        Map<String, List<CatalogEntry>> namespaces;
    }

    static class CatalogEntry {
        String name;
        List<String> args;
        String description;
    }

    // ---- Loading ----

    /**
     * Loads the catalog bundled in the server jar.
     *
     * @throws UncheckedIOException if the resource is missing or malformed
     */
    public static FunctionCatalog loadBundled() {
        InputStream stream = FunctionCatalog.class.getResourceAsStream(BUNDLED_RESOURCE);
        if (stream == null) {
            throw new UncheckedIOException(new IOException("Missing bundled catalog " + BUNDLED_RESOURCE));
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return read(reader, BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Loads a catalog from a file.
     *
     * @throws UncheckedIOException if the file cannot be read or is malformed
     */
    public static FunctionCatalog load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read function catalog " + file, e);
        }
    }

    static FunctionCatalog read(Reader reader, String origin) throws IOException {
        CatalogFile data;
        try {
            data = GSON.fromJson(reader, CatalogFile.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed function catalog " + origin + ": " + e.getMessage(), e);
        }
        if (data == null) {
            throw new IOException("Empty function catalog " + origin);
        }
        String separator = data.separator == null || data.separator.isEmpty() ? DEFAULT_SEPARATOR : data.separator;
        String language = data.language == null || data.language.isEmpty() ? "catalog" : data.language;
        Map<String, List<FunctionDoc>> namespaces = new LinkedHashMap<>();
        if (data.namespaces != null) {
            for (Map.Entry<String, List<CatalogEntry>> entry : data.namespaces.entrySet()) {
                List<FunctionDoc> docs = new ArrayList<>();
                if (entry.getValue() != null) {
                    for (CatalogEntry function : entry.getValue()) {
                        if (function == null || function.name == null || function.name.isEmpty()) {
                            logger.warn("Skipping unnamed function in namespace {} of {}", entry.getKey(), origin);
                            continue;
                        }
                        if (function.args != null && function.args.contains(null)) {
                            throw new IOException("Null argument name for function " + entry.getKey()
                                    + separator + function.name + " in " + origin);
                        }
                        docs.add(new FunctionDoc(new FunctionSignature(function.name, function.args),
                                function.description));
                    }
                }
                namespaces.put(entry.getKey(), Collections.unmodifiableList(docs));
            }
        }
        logger.info("Loaded function catalog {} ({} namespaces) from {}", language, namespaces.size(), origin);
        return new FunctionCatalog(language, separator, Collections.unmodifiableMap(namespaces));
    }

    // ---- Queries ----

    public String getLanguage() {
        return language;
    }

    public String getSeparator() {
        return separator;
    }

    public List<String> getNamespaces() {
        return new ArrayList<>(namespaces.keySet());
    }

    /**
     * Function names of {@code namespace} in catalog order, or an empty list
     * for an unknown namespace.
     */
    public List<String> functionNames(String namespace) {
        List<FunctionDoc> docs = namespaces.get(namespace);
        if (docs == null) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>(docs.size());
        for (FunctionDoc doc : docs) {
            names.add(doc.getSignature().getName());
        }
        return names;
    }

    public Optional<FunctionDoc> find(String qualifiedName) {
        return Optional.ofNullable(byQualifiedName.get(qualifiedName));
    }
}
