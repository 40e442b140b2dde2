package com.example.ilibrary.backup;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.ilibrary.command.ClCommands;
import com.example.ilibrary.command.ClCommands.ObjectName;
import com.example.ilibrary.command.RemoteCommand.CommandChannel;
import com.example.ilibrary.command.RemoteCommand.CommandException;
import com.example.ilibrary.config.AppConfig;
import com.example.ilibrary.savefile.SaveFiles.SaveFileManager;
import com.example.ilibrary.session.HostSession.Credentials;
import com.example.ilibrary.transfer.SecureTransfer.TransferException;
import com.example.ilibrary.transfer.SecureTransfer.TransferSession;

/**
 * Agrega serviços e modelos relacionados ao fluxo de backup de bibliotecas.
 */
public final class Backup {

    private Backup() {}

    /**
     * Orquestrador do Backup. Liga CRTSAVF -> SAVLIB -> [CPYTOSTMF -> SFTP -> rm -> [DLTF]] -> commit.
     *
     * Cada passo depende do anterior. Falhas de comando fazem rollback da conexão
     * e viram um BackupResult com falha; falhas no download e na remoção do save
     * file sobem como {@link CompensationException}, pois podem deixar artefatos no host.
     * Nada é repetido automaticamente.
     */
    public static final class BackupCoordinator {
        private static final Logger log = LoggerFactory.getLogger(BackupCoordinator.class);

        private final CommandChannel commands;
        private final SaveFileManager saveFiles;
        private final TransferSession transfer;
        private final Credentials credentials;

        public BackupCoordinator(CommandChannel commands, SaveFileManager saveFiles,
                                 TransferSession transfer, Credentials credentials) {
            this.commands = Objects.requireNonNull(commands, "commands");
            this.saveFiles = Objects.requireNonNull(saveFiles, "saveFiles");
            this.transfer = Objects.requireNonNull(transfer, "transfer");
            this.credentials = Objects.requireNonNull(credentials, "credentials");
        }

        /**
         * Executa o backup descrito pelo request.
         *
         * @return resultado com o estado final (DONE ou FAILED)
         * @throws DownloadFailedException se a transferência do stream file falhar
         * @throws SaveFileRemovalException se o save file não puder ser removido após o download
         */
        public BackupResult run(BackupRequest request) throws DownloadFailedException, SaveFileRemovalException {
            Objects.requireNonNull(request, "request");
            Progress progress = new Progress();
            ObjectName library = request.library();
            ObjectName toLibrary = request.toLibrary();
            ObjectName saveFile = request.saveFile();

            log.info("=== JOB START: SAVLIB {} -> {}/{} (download={}, TGTRLS={}) ===",
                    library, toLibrary, saveFile, request.download(), request.targetRelease());

            // 1. CRTSAVF
            try {
                saveFiles.create(saveFile, toLibrary, request.description());
            } catch (CommandException e) {
                return progress.fail("Falha ao criar o save file " + toLibrary + "/" + saveFile + ": " + e.getMessage(),
                        Collections.emptyList());
            }
            progress.advance(BackupState.CONTAINER_CREATED);

            // 2. SAVLIB
            try {
                commands.execute(ClCommands.saveLibrary(library, toLibrary, saveFile, request.targetRelease()));
            } catch (CommandException e) {
                log.error("SAVLIB da biblioteca {} falhou: {}", library, e.getMessage());
                commands.rollback();
                return progress.fail("Falha ao salvar a biblioteca " + library + ": " + e.getMessage(),
                        compensatePopulateFailure(request));
            }
            progress.advance(BackupState.POPULATED);

            Path localFile = null;
            List<String> leftovers = new ArrayList<>();
            if (request.download()) {
                TransferOptions options = request.transfer().orElseThrow();
                String streamFile = request.remoteStreamFile();

                // 3a. CPYTOSTMF
                try {
                    commands.execute(ClCommands.copyToStreamFile(toLibrary, saveFile, streamFile));
                } catch (CommandException e) {
                    log.error("CPYTOSTMF para {} falhou: {}", streamFile, e.getMessage());
                    commands.rollback();
                    return progress.fail("Falha ao converter o save file em stream file: " + e.getMessage(),
                            List.of(request.saveFilePath()));
                }

                // 3b. SFTP
                Instant startDownload = Instant.now();
                try {
                    transfer.download(streamFile, request.localFile(), credentials, options.port());
                } catch (TransferException e) {
                    BackupState reached = progress.current();
                    progress.advance(BackupState.FAILED);
                    log.error("Download de {} falhou ({}): {}", streamFile, e.reason(), e.getMessage());
                    throw new DownloadFailedException(reached, streamFile, e);
                }
                localFile = request.localFile();
                log.info("Download finalizado em {}s: {}",
                        Duration.between(startDownload, Instant.now()).toSeconds(), localFile);

                // 3c. rm do stream file temporário, sempre após download bem-sucedido
                try {
                    commands.execute(ClCommands.removeStreamFile(streamFile));
                } catch (CommandException e) {
                    log.warn("Stream file temporário {} não foi removido: {}", streamFile, e.getMessage());
                    commands.rollback();
                    leftovers.add(streamFile);
                }
                progress.advance(BackupState.TRANSFERRED);

                // 4. DLTF
                if (options.deleteRemoteAfterTransfer()) {
                    try {
                        saveFiles.remove(toLibrary, saveFile);
                    } catch (CommandException e) {
                        BackupState reached = progress.current();
                        progress.advance(BackupState.FAILED);
                        throw new SaveFileRemovalException(reached, request.saveFilePath(), e);
                    }
                    progress.advance(BackupState.REMOTE_CLEANED);
                }
            }

            // 5. commit final
            try {
                commands.commit();
            } catch (CommandException e) {
                commands.rollback();
                return progress.fail("Falha no commit final: " + e.getMessage(), leftovers);
            }
            progress.advance(BackupState.DONE);

            if (localFile != null) {
                log.info("=== JOB DONE: save file baixado em {} ===", localFile);
            } else {
                log.info("=== JOB DONE: biblioteca {} salva em {}/{} ===", library, toLibrary, saveFile);
            }
            return new BackupResult(BackupState.DONE, progress.path(), localFile, leftovers, null);
        }

        /**
         * O save file vazio permanece no host, salvo pedido explícito de remoção.
         */
        private List<String> compensatePopulateFailure(BackupRequest request) {
            if (!request.removeSaveFileOnPopulateFailure()) {
                return List.of(request.saveFilePath());
            }
            try {
                saveFiles.remove(request.toLibrary(), request.saveFile());
                return Collections.emptyList();
            } catch (CommandException e) {
                log.warn("Save file vazio {} não pôde ser removido: {}", request.saveFilePath(), e.getMessage());
                return List.of(request.saveFilePath());
            }
        }

        /** Rastreia as transições de uma execução. */
        private static final class Progress {
            private final List<BackupState> path = new ArrayList<>(List.of(BackupState.INIT));
            private BackupState current = BackupState.INIT;

            BackupState current() { return current; }

            void advance(BackupState next) {
                current = BackupState.transition(current, next);
                path.add(next);
            }

            List<BackupState> path() { return List.copyOf(path); }

            BackupResult fail(String message, List<String> leftovers) {
                advance(BackupState.FAILED);
                log.error("=== JOB FAILED: {} ===", message);
                return new BackupResult(BackupState.FAILED, path(), null, leftovers, message);
            }
        }
    }

    // ==================================================================================
    // Máquina de estados
    // ==================================================================================

    /**
     * Estados de uma execução de backup.
     *
     * <pre>
     * INIT -> CONTAINER_CREATED -> POPULATED -> [TRANSFERRED] -> [REMOTE_CLEANED] -> DONE
     * qualquer estado não terminal -> FAILED
     * </pre>
     */
    public enum BackupState {
        INIT,
        CONTAINER_CREATED,
        POPULATED,
        TRANSFERRED,
        REMOTE_CLEANED,
        DONE,
        FAILED;

        public boolean isTerminal() {
            return this == DONE || this == FAILED;
        }

        private Set<BackupState> successors() {
            return switch (this) {
                case INIT -> EnumSet.of(CONTAINER_CREATED, FAILED);
                case CONTAINER_CREATED -> EnumSet.of(POPULATED, FAILED);
                case POPULATED -> EnumSet.of(TRANSFERRED, DONE, FAILED);
                case TRANSFERRED -> EnumSet.of(REMOTE_CLEANED, DONE, FAILED);
                case REMOTE_CLEANED -> EnumSet.of(DONE, FAILED);
                case DONE, FAILED -> EnumSet.noneOf(BackupState.class);
            };
        }

        public boolean canTransitionTo(BackupState next) {
            return next != null && successors().contains(next);
        }

        /**
         * Valida e executa a transição.
         *
         * @throws IllegalArgumentException se algum estado for null
         * @throws IllegalStateException se a transição não for permitida
         */
        public static BackupState transition(BackupState from, BackupState to) {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Estados não podem ser null (from: " + from + ", to: " + to + ")");
            }
            if (from.isTerminal()) {
                throw new IllegalStateException("Transição a partir de estado terminal: " + from + " -> " + to);
            }
            if (!from.canTransitionTo(to)) {
                throw new IllegalStateException("Transição inválida: " + from + " -> " + to);
            }
            return to;
        }
    }

    // ==================================================================================
    // Request / opções
    // ==================================================================================

    /**
     * Parâmetros de um backup. Validados em {@link Builder#build()}, antes de
     * qualquer chamada remota.
     */
    public static final class BackupRequest {
        private final ObjectName library;
        private final ObjectName saveFile;
        private final ObjectName toLibrary;
        private final String description;
        private final String targetRelease;
        private final TransferOptions transfer;
        private final boolean removeSaveFileOnPopulateFailure;

        private BackupRequest(Builder b, ObjectName library, ObjectName saveFile, ObjectName toLibrary,
                              String targetRelease, TransferOptions transfer) {
            this.library = library;
            this.saveFile = saveFile;
            this.toLibrary = toLibrary;
            this.description = b.description == null || b.description.isBlank()
                    ? ClCommands.DEFAULT_DESCRIPTION
                    : b.description;
            this.targetRelease = targetRelease;
            this.transfer = transfer;
            this.removeSaveFileOnPopulateFailure = b.removeSaveFileOnPopulateFailure;
        }

        public static Builder builder(String library, String saveFileName) {
            return new Builder(library, saveFileName);
        }

        public ObjectName library() { return library; }
        public ObjectName saveFile() { return saveFile; }
        public ObjectName toLibrary() { return toLibrary; }
        public String description() { return description; }
        public String targetRelease() { return targetRelease; }
        public boolean download() { return transfer != null; }
        public Optional<TransferOptions> transfer() { return Optional.ofNullable(transfer); }
        public boolean removeSaveFileOnPopulateFailure() { return removeSaveFileOnPopulateFailure; }

        /** Caminho do save file no QSYS.LIB. */
        public String saveFilePath() {
            return ClCommands.qsysPath(toLibrary, saveFile);
        }

        /** Stream file temporário no IFS: remoteDirectory/SAVF.savf */
        public String remoteStreamFile() {
            TransferOptions t = requireTransfer();
            return t.remoteDirectory() + "/" + saveFile + ".savf";
        }

        /** Destino local: localDirectory/SAVF.savf */
        public Path localFile() {
            TransferOptions t = requireTransfer();
            return Path.of(t.localDirectory() + "/" + saveFile + ".savf");
        }

        private TransferOptions requireTransfer() {
            if (transfer == null) {
                throw new IllegalStateException("Backup sem download configurado");
            }
            return transfer;
        }

        @Override
        public String toString() {
            return "BackupRequest{library=" + library + ", saveFile=" + toLibrary + "/" + saveFile
                    + ", targetRelease=" + targetRelease + ", transfer=" + transfer + "}";
        }

        public static final class Builder {
            private final String library;
            private final String saveFileName;
            private String toLibrary;
            private String description;
            private String targetRelease;
            private boolean download;
            private String remoteDirectory;
            private String localDirectory;
            private Integer port;
            private boolean deleteRemoteAfterTransfer = true;
            private boolean removeSaveFileOnPopulateFailure;

            private Builder(String library, String saveFileName) {
                this.library = library;
                this.saveFileName = saveFileName;
            }

            /** Biblioteca onde o save file é criado; padrão: a própria biblioteca salva. */
            public Builder toLibrary(String v) { this.toLibrary = v; return this; }
            public Builder description(String v) { this.description = v; return this; }
            public Builder targetRelease(String v) { this.targetRelease = v; return this; }

            /** Liga o download e define os diretórios remoto (IFS) e local. */
            public Builder download(String remoteDirectory, String localDirectory) {
                this.download = true;
                this.remoteDirectory = remoteDirectory;
                this.localDirectory = localDirectory;
                return this;
            }

            public Builder download(boolean v) { this.download = v; return this; }
            public Builder remoteDirectory(String v) { this.remoteDirectory = v; return this; }
            public Builder localDirectory(String v) { this.localDirectory = v; return this; }
            /** Porta SSH; null usa a padrão (2222). */
            public Builder port(Integer v) { this.port = v; return this; }

            /**
             * Remove o save file do host (DLTF) depois do download; padrão true.
             * O stream file temporário é removido sempre que o download termina bem.
             */
            public Builder deleteRemoteAfterTransfer(boolean v) { this.deleteRemoteAfterTransfer = v; return this; }
            public Builder removeSaveFileOnPopulateFailure(boolean v) { this.removeSaveFileOnPopulateFailure = v; return this; }

            /**
             * Valida todos os argumentos.
             *
             * @throws IllegalArgumentException em qualquer argumento ausente ou inválido
             */
            public BackupRequest build() {
                ObjectName lib = ObjectName.of(library, "biblioteca");
                ObjectName savf = ObjectName.of(saveFileName, "save file");
                ObjectName target = toLibrary == null || toLibrary.isBlank()
                        ? lib
                        : ObjectName.of(toLibrary, "biblioteca de destino");
                ClCommands.description(description);
                String release = ClCommands.targetRelease(targetRelease);

                TransferOptions transferOptions = null;
                if (download) {
                    if (remoteDirectory == null || remoteDirectory.isEmpty()) {
                        throw new IllegalArgumentException("Um caminho remoto é obrigatório para o download.");
                    }
                    if (localDirectory == null || localDirectory.isEmpty()) {
                        throw new IllegalArgumentException("Um caminho local é obrigatório para o download.");
                    }
                    String remote = stripTrailingSlash(remoteDirectory);
                    String local = stripTrailingSlash(localDirectory);
                    ClCommands.ifsPath(remote + "/" + savf + ".savf");
                    int effectivePort = port == null ? AppConfig.DEFAULT_SSH_PORT : port;
                    if (effectivePort < 1 || effectivePort > 65535) {
                        throw new IllegalArgumentException("Porta inválida: " + port);
                    }
                    transferOptions = new TransferOptions(remote, local, effectivePort, deleteRemoteAfterTransfer);
                }
                return new BackupRequest(this, lib, savf, target, release, transferOptions);
            }

            /** Remove uma única barra final. */
            static String stripTrailingSlash(String path) {
                return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
            }
        }
    }

    /**
     * Opções do passo de transferência. Os diretórios já chegam sem a barra final.
     * {@code deleteRemoteAfterTransfer} controla o DLTF; o rm do stream file não é opcional.
     */
    public static record TransferOptions(String remoteDirectory,
                                         String localDirectory,
                                         int port,
                                         boolean deleteRemoteAfterTransfer) {

        /** O artefato remoto removido após a transferência é o próprio save file. */
        public boolean deleteArchiveContainerAfterTransfer() {
            return deleteRemoteAfterTransfer;
        }
    }

    // ==================================================================================
    // Resultado e exceções
    // ==================================================================================

    public static final class BackupResult {
        private final BackupState state;
        private final List<BackupState> path;
        private final Path localFile;
        private final List<String> leftoverArtifacts;
        private final String error;

        public BackupResult(BackupState state, List<BackupState> path, Path localFile,
                            List<String> leftoverArtifacts, String error) {
            this.state = Objects.requireNonNull(state, "state");
            this.path = List.copyOf(path);
            this.localFile = localFile;
            this.leftoverArtifacts = List.copyOf(leftoverArtifacts);
            this.error = error;
        }

        /** true somente quando o backup chegou a DONE. */
        public boolean succeeded() { return state == BackupState.DONE; }
        public BackupState state() { return state; }
        /** Estados percorridos, começando em INIT. */
        public List<BackupState> path() { return path; }
        public Optional<Path> localFile() { return Optional.ofNullable(localFile); }
        /** Artefatos que podem ter ficado no host (save file, stream file). */
        public List<String> leftoverArtifacts() { return leftoverArtifacts; }
        public Optional<String> error() { return Optional.ofNullable(error); }

        @Override
        public String toString() {
            return "BackupResult{state=" + state + ", localFile=" + localFile
                    + ", leftovers=" + leftoverArtifacts + (error != null ? ", error=" + error : "") + "}";
        }
    }

    /**
     * Falha em um passo após o qual um artefato remoto pode ter permanecido no host.
     */
    public abstract static class CompensationException extends IOException {
        private final BackupState reachedState;
        private final String remoteArtifact;

        protected CompensationException(String message, BackupState reachedState, String remoteArtifact, Throwable cause) {
            super(message, cause);
            this.reachedState = reachedState;
            this.remoteArtifact = remoteArtifact;
        }

        /** Último estado alcançado antes da falha. */
        public BackupState reachedState() { return reachedState; }
        public String remoteArtifact() { return remoteArtifact; }
    }

    /** O download do stream file não teve sucesso; o stream file continua no IFS. */
    public static final class DownloadFailedException extends CompensationException {
        public DownloadFailedException(BackupState reachedState, String streamFile, TransferException cause) {
            super("O download do save file não teve sucesso (" + cause.reason() + "): " + cause.getMessage(),
                    reachedState, streamFile, cause);
        }

        public TransferException.Reason reason() {
            return ((TransferException) getCause()).reason();
        }
    }

    /** O save file não foi removido após o download. */
    public static final class SaveFileRemovalException extends CompensationException {
        public SaveFileRemovalException(BackupState reachedState, String saveFilePath, CommandException cause) {
            super("O save file " + saveFilePath + " não foi removido com sucesso: " + cause.getMessage(),
                    reachedState, saveFilePath, cause);
        }
    }
}
