////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.trillls;

import com.tomaszrup.trillls.core.ColumnEncoding;
import com.tomaszrup.trillls.core.DocumentStore;
import com.tomaszrup.trillls.core.LanguageCore;
import com.tomaszrup.trillls.language.LanguageCapability;
import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.PositionEncodingKind;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.WorkspaceFoldersOptions;
import org.eclipse.lsp4j.WorkspaceServerCapabilities;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

public class TrillLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(TrillLanguageServer.class);

    static final String SERVER_NAME = "trill-language-server";

    private static final String USAGE = "Usage: trill-language-server [--tcp [port]] [--language groovy|catalog]"
            + " [--catalog file] [--close-policy remove|retain] [--column-encoding utf16|codepoint]";

    public static void main(String[] args) throws IOException {
        // Log uncaught exceptions on any thread instead of silently killing
        // the JVM process (which the client sees as an EPIPE).
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });

        // Suppress noisy "Unmatched cancel notification for request id" warnings
        // from LSP4J's RemoteEndpoint.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);

        ServerOptions options;
        LanguageCapability language;
        try {
            options = ServerOptions.parse(args);
            language = options.getLanguage().create(options.getCatalogFile());
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        } catch (UncheckedIOException e) {
            logger.error("Cannot start language support: {}", e.getMessage());
            System.exit(1);
            return;
        }

        if (options.isTcp()) {
            int port = options.getPort();
            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Trill Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");

                    InputStream in = socket.getInputStream();
                    OutputStream out = socket.getOutputStream();
                    startServer(new TrillLanguageServer(language, options), in, out);
                }
            }
        } else {
            logger.info("Trill Language Server starting in stdio mode.");
            InputStream in = System.in;
            OutputStream out = System.out;
            startServer(new TrillLanguageServer(language, options), in, out);
        }
    }

    private static void startServer(TrillLanguageServer server, InputStream in, OutputStream out) {
        // Redirect System.out to System.err to avoid corrupting the communication channel
        System.setOut(new PrintStream(System.err));

        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // Block the main (non-daemon) thread on the listener future; all pool
        // threads are daemons and would not keep the JVM alive.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final LanguageCore core;
    private final TrillServices trillServices;
    /** Shared executor pools for all server components. */
    private final ExecutorPools executorPools = new ExecutorPools();
    private volatile LanguageClient client;

    public TrillLanguageServer(LanguageCapability language) {
        this(new LanguageCore(language));
    }

    TrillLanguageServer(LanguageCapability language, ServerOptions options) {
        this(new LanguageCore(language, new DocumentStore(options.getClosePolicy()), options.getColumnEncoding()));
    }

    TrillLanguageServer(LanguageCore core) {
        this.core = core;
        this.trillServices = new TrillServices(core, executorPools);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        if (options != null) {
            if (options.closePolicy != null) {
                core.setClosePolicy(options.closePolicy);
            }
            if (options.columnEncoding != null) {
                core.setColumnEncoding(options.columnEncoding);
            }
        }
        if (core.getColumnEncoding() == ColumnEncoding.CODE_POINT
                && !clientOffersEncoding(params, PositionEncodingKind.UTF32)) {
            logger.warn("Client does not offer {} position encoding; falling back to {}",
                    PositionEncodingKind.UTF32, PositionEncodingKind.UTF16);
            core.setColumnEncoding(ColumnEncoding.UTF16);
        }

        LanguageCapability language = core.getLanguage();
        CompletionOptions completionOptions = new CompletionOptions(false, language.completionTriggerCharacters());
        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        serverCapabilities.setCompletionProvider(completionOptions);
        serverCapabilities.setHoverProvider(true);
        serverCapabilities.setPositionEncoding(core.getColumnEncoding() == ColumnEncoding.CODE_POINT
                ? PositionEncodingKind.UTF32
                : PositionEncodingKind.UTF16);

        WorkspaceFoldersOptions workspaceFolders = new WorkspaceFoldersOptions();
        workspaceFolders.setSupported(true);
        workspaceFolders.setChangeNotifications(Either.forRight(true));
        serverCapabilities.setWorkspace(new WorkspaceServerCapabilities(workspaceFolders));

        InitializeResult initializeResult = new InitializeResult(serverCapabilities,
                new ServerInfo(SERVER_NAME, getVersion()));
        return CompletableFuture.completedFuture(initializeResult);
    }

    /**
     * A server may only pick a position encoding the client listed in
     * {@code general.positionEncodings}; UTF-16 is always implied.
     */
    static boolean clientOffersEncoding(InitializeParams params, String encoding) {
        ClientCapabilities capabilities = params.getCapabilities();
        if (capabilities == null || capabilities.getGeneral() == null) {
            return false;
        }
        List<String> offered = capabilities.getGeneral().getPositionEncodings();
        return offered != null && offered.contains(encoding);
    }

    @Override
    public void initialized(InitializedParams params) {
        logProgress("Initialized Trill (" + core.getLanguage().id() + ")");
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        executorPools.shutdownAll();
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return trillServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return trillServices;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
        trillServices.connect(client);
    }

    LanguageCore getCore() {
        return core;
    }

    /** Send a progress log message to the client (visible in output channel). */
    private void logProgress(String message) {
        logger.info(message);
        LanguageClient current = client;
        if (current != null) {
            current.logMessage(new MessageParams(MessageType.Info, message));
        }
    }

    static String getVersion() {
        String version = TrillLanguageServer.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
