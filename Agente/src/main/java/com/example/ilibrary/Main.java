package com.example.ilibrary;

import com.example.ilibrary.backup.Backup.BackupRequest;
import com.example.ilibrary.backup.Backup.BackupResult;
import com.example.ilibrary.backup.Backup.CompensationException;
import com.example.ilibrary.config.AppConfig;
import com.example.ilibrary.library.LibraryClient;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataQueryException;
import java.io.PrintStream;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entrada headless (sem UI). Um comando por execução:
 *
 * <pre>
 * save    LIB SAVF [--to LIB] [--description TXT] [--release VxRyMz]
 *                  [--download] [--remote-dir DIR] [--local-dir DIR] [--port N]
 *                  [--keep-savf] [--remove-savf-on-failure]
 * remove  LIB SAVF
 * info    LIB
 * objects LIB
 * members LIB
 * </pre>
 *
 * Conexão e credenciais vêm do {@link AppConfig}.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> VALUE_OPTIONS = Set.of("to", "description", "release", "remote-dir", "local-dir", "port");
    private static final Set<String> FLAG_OPTIONS = Set.of("download", "keep-savf", "remove-savf-on-failure");

    public static void main(String[] args) throws Exception {
        int code = new Main().run(args, System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    public int run(String[] args, PrintStream out) throws SQLException {
        Invocation invocation;
        try {
            invocation = parse(args);
        } catch (IllegalArgumentException e) {
            LOGGER.severe(e.getMessage());
            out.println(usage());
            return EXIT_USAGE;
        }
        AppConfig config = AppConfig.load();
        LOGGER.info(() -> "Configuracao: " + config);
        try (LibraryClient client = LibraryClient.open(config)) {
            return execute(invocation, client, out);
        }
    }

    int execute(Invocation invocation, LibraryClient client, PrintStream out) {
        List<String> args = invocation.arguments();
        try {
            switch (invocation.command()) {
                case "save":
                    return save(invocation, client, out);
                case "remove":
                    if (client.removeFile(args.get(0), args.get(1))) {
                        out.println("Save file " + args.get(0) + "/" + args.get(1) + " removido.");
                        return EXIT_OK;
                    }
                    return EXIT_FAILED;
                case "info":
                    out.println(client.getInfoForLibrary(args.get(0)));
                    return EXIT_OK;
                case "objects":
                    out.println(client.getFileInfo(args.get(0), false));
                    return EXIT_OK;
                case "members":
                    out.println(client.getFileInfo(args.get(0), true));
                    return EXIT_OK;
                default:
                    throw new IllegalStateException("Comando não tratado: " + invocation.command());
            }
        } catch (IllegalArgumentException e) {
            LOGGER.severe("Argumento invalido: " + e.getMessage());
            return EXIT_USAGE;
        } catch (CompensationException e) {
            LOGGER.severe(e.getMessage() + " (artefato no host: " + e.remoteArtifact() + ")");
            return EXIT_FAILED;
        } catch (MetadataQueryException e) {
            LOGGER.severe(e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int save(Invocation invocation, LibraryClient client, PrintStream out) throws CompensationException {
        BackupRequest request = toRequest(invocation, client);
        BackupResult result = client.saveLibrary(request);
        if (!result.leftoverArtifacts().isEmpty()) {
            LOGGER.warning("Artefatos que ficaram no host: " + result.leftoverArtifacts());
        }
        if (!result.succeeded()) {
            LOGGER.severe("Backup falhou: " + result.error().orElse("motivo desconhecido"));
            return EXIT_FAILED;
        }
        out.println(result.localFile()
                .map(p -> "Save file baixado em " + p)
                .orElse("Biblioteca " + request.library() + " salva em " + request.saveFilePath()));
        return EXIT_OK;
    }

    static BackupRequest toRequest(Invocation invocation, LibraryClient client) {
        List<String> args = invocation.arguments();
        BackupRequest.Builder builder = client.newRequest(args.get(0), args.get(1));
        Map<String, String> options = invocation.options();
        if (options.containsKey("to")) builder.toLibrary(options.get("to"));
        if (options.containsKey("description")) builder.description(options.get("description"));
        if (options.containsKey("release")) builder.targetRelease(options.get("release"));
        if (options.containsKey("remote-dir")) builder.remoteDirectory(options.get("remote-dir"));
        if (options.containsKey("local-dir")) builder.localDirectory(options.get("local-dir"));
        if (options.containsKey("port")) builder.port(parsePort(options.get("port")));
        builder.download(options.containsKey("download"));
        builder.deleteRemoteAfterTransfer(!options.containsKey("keep-savf"));
        builder.removeSaveFileOnPopulateFailure(options.containsKey("remove-savf-on-failure"));
        return builder.build();
    }

    private static Integer parsePort(String raw) {
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Porta invalida: " + raw, e);
        }
    }

    /**
     * Interpreta a linha de comando.
     *
     * @throws IllegalArgumentException para comando desconhecido, aridade errada ou opção inválida
     */
    static Invocation parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("Nenhum comando informado.");
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        int arity = arity(command);
        List<String> positional = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                String name = arg.substring(2);
                if (!"save".equals(command)) {
                    throw new IllegalArgumentException("O comando " + command + " não aceita opções: " + arg);
                }
                if (FLAG_OPTIONS.contains(name)) {
                    options.put(name, "true");
                } else if (VALUE_OPTIONS.contains(name)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Opção sem valor: " + arg);
                    }
                    options.put(name, args[++i]);
                } else {
                    throw new IllegalArgumentException("Opção desconhecida: " + arg);
                }
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() != arity) {
            throw new IllegalArgumentException("O comando " + command + " espera " + arity + " argumento(s), recebeu " + positional.size() + ".");
        }
        return new Invocation(command, List.copyOf(positional), Collections.unmodifiableMap(options));
    }

    private static int arity(String command) {
        switch (command) {
            case "save":
            case "remove":
                return 2;
            case "info":
            case "objects":
            case "members":
                return 1;
            default:
                throw new IllegalArgumentException("Comando desconhecido: " + command);
        }
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Uso:",
                "  save    LIB SAVF [--to LIB] [--description TXT] [--release VxRyMz]",
                "                   [--download] [--remote-dir DIR] [--local-dir DIR] [--port N]",
                "                   [--keep-savf] [--remove-savf-on-failure]",
                "  remove  LIB SAVF",
                "  info    LIB",
                "  objects LIB",
                "  members LIB");
    }

    /** Linha de comando já interpretada. */
    record Invocation(String command, List<String> arguments, Map<String, String> options) {}
}
