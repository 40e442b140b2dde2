package com.example.ilibrary.transfer;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.ilibrary.config.AppConfig;
import com.example.ilibrary.session.HostSession.Credentials;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;

/**
 * Transferência segura de arquivos entre o host IBM i e a máquina local.
 */
public final class SecureTransfer {

    private SecureTransfer() {}

    /** Move exatamente um arquivo do host para um caminho local. */
    public interface TransferSession {

        /**
         * Abre uma sessão autenticada, copia {@code remotePath} para {@code localPath}
         * e libera canal e sessão em qualquer caminho de saída. Um arquivo já
         * existente em {@code localPath} só é substituído quando a cópia termina.
         *
         * @throws IllegalArgumentException se algum caminho estiver vazio
         * @throws TransferException com o motivo da falha
         */
        void download(String remotePath, Path localPath, Credentials credentials, int port) throws TransferException;
    }

    /**
     * SFTP via JSch. Cada chamada cria e descarta a própria sessão SSH.
     */
    public static final class SftpTransferSession implements TransferSession {
        private static final Logger log = LoggerFactory.getLogger(SftpTransferSession.class);

        private final Supplier<JSch> jschFactory;
        private final int connectTimeoutMillis;
        private final boolean strictHostKeyChecking;
        private final String knownHostsFile;

        public SftpTransferSession(AppConfig config) {
            this(JSch::new, config.sshConnectTimeoutMillis(), config.strictHostKeyChecking(),
                    config.sshKnownHosts().orElse(null));
        }

        /**
         * Construtor permitindo injetar a fábrica do JSch (útil para testes).
         */
        public SftpTransferSession(Supplier<JSch> jschFactory, int connectTimeoutMillis,
                                   boolean strictHostKeyChecking, String knownHostsFile) {
            this.jschFactory = Objects.requireNonNull(jschFactory, "jschFactory");
            this.connectTimeoutMillis = connectTimeoutMillis;
            this.strictHostKeyChecking = strictHostKeyChecking;
            this.knownHostsFile = knownHostsFile;
        }

        @Override
        public void download(String remotePath, Path localPath, Credentials credentials, int port) throws TransferException {
            if (remotePath == null || remotePath.isBlank()) {
                throw new IllegalArgumentException("Um caminho remoto é obrigatório.");
            }
            if (localPath == null || localPath.toString().isBlank()) {
                throw new IllegalArgumentException("Um caminho local é obrigatório.");
            }
            Objects.requireNonNull(credentials, "credentials");
            int effectivePort = port > 0 ? port : AppConfig.DEFAULT_SSH_PORT;

            Path directory = prepareLocalDirectory(localPath);

            Session session = null;
            ChannelSftp sftp = null;
            Path partial = null;
            try {
                JSch jsch = jschFactory.get();
                if (knownHostsFile != null) {
                    jsch.setKnownHosts(knownHostsFile);
                }
                session = jsch.getSession(credentials.user(), credentials.host(), effectivePort);
                session.setPassword(credentials.password());
                session.setConfig("StrictHostKeyChecking", strictHostKeyChecking ? "yes" : "no");
                session.connect(connectTimeoutMillis);

                sftp = (ChannelSftp) session.openChannel("sftp");
                sftp.connect(connectTimeoutMillis);

                // o destino só é substituído depois da cópia completa
                partial = Files.createTempFile(directory, localPath.getFileName() + ".", ".part");
                log.info("Baixando {}:{} -> {}", credentials.host(), remotePath, localPath);
                sftp.get(remotePath, partial.toString());
                replace(partial, localPath);
                partial = null;
                log.info("Download concluído: {}", localPath);
            } catch (JSchException e) {
                throw classify(e, credentials.host(), effectivePort);
            } catch (SftpException e) {
                throw classify(e, remotePath, localPath);
            } catch (IOException e) {
                throw new TransferException(TransferException.Reason.LOCAL_IO_ERROR,
                        "Não foi possível gravar " + localPath + ": " + e.getMessage(), e);
            } finally {
                if (sftp != null) {
                    sftp.disconnect();
                }
                if (session != null) {
                    session.disconnect();
                }
                if (partial != null) {
                    discardPartial(partial);
                }
            }
        }

        private Path prepareLocalDirectory(Path localPath) throws TransferException {
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent == null) {
                throw new IllegalArgumentException("Caminho local sem diretório: " + localPath);
            }
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new TransferException(TransferException.Reason.LOCAL_IO_ERROR,
                        "Não foi possível preparar o diretório local " + parent + ": " + e.getMessage(), e);
            }
            return parent;
        }

        private static void replace(Path partial, Path localPath) throws IOException {
            try {
                Files.move(partial, localPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, localPath, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        private void discardPartial(Path partial) {
            try {
                if (Files.deleteIfExists(partial)) {
                    log.warn("Arquivo local parcial removido: {}", partial);
                }
            } catch (IOException e) {
                log.warn("Falha ao remover arquivo local parcial {}: {}", partial, e.toString());
            }
        }

        static TransferException classify(JSchException e, String host, int port) {
            String message = e.getMessage() != null ? e.getMessage() : "";
            if (message.startsWith("Auth")) {
                return new TransferException(TransferException.Reason.AUTHENTICATION_FAILED,
                        "Autenticação SSH recusada em " + host + ":" + port + ". Verifique usuário e senha.", e);
            }
            return new TransferException(TransferException.Reason.PROTOCOL_ERROR,
                    "Erro SSH com " + host + ":" + port + ": " + message, e);
        }

        static TransferException classify(SftpException e, String remotePath, Path localPath) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return new TransferException(TransferException.Reason.REMOTE_FILE_NOT_FOUND,
                        "Arquivo não encontrado no host: " + remotePath, e);
            }
            Throwable cause = e.getCause();
            if (cause instanceof FileNotFoundException || cause instanceof AccessDeniedException) {
                return new TransferException(TransferException.Reason.LOCAL_IO_ERROR,
                        "Não foi possível gravar " + localPath + ": " + cause.getMessage(), e);
            }
            return new TransferException(TransferException.Reason.PROTOCOL_ERROR,
                    "Erro SFTP ao copiar " + remotePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Falha de transferência, com motivo distinto para que quem chama decida
     * entre tentar de novo ou abortar.
     */
    public static final class TransferException extends IOException {

        public enum Reason {
            AUTHENTICATION_FAILED,
            PROTOCOL_ERROR,
            REMOTE_FILE_NOT_FOUND,
            LOCAL_IO_ERROR
        }

        private final Reason reason;

        public TransferException(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public Reason reason() { return reason; }
    }
}
