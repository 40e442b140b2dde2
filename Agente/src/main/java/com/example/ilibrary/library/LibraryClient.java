package com.example.ilibrary.library;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.ilibrary.backup.Backup.BackupCoordinator;
import com.example.ilibrary.backup.Backup.BackupRequest;
import com.example.ilibrary.backup.Backup.BackupResult;
import com.example.ilibrary.backup.Backup.DownloadFailedException;
import com.example.ilibrary.backup.Backup.SaveFileRemovalException;
import com.example.ilibrary.command.RemoteCommand.CommandException;
import com.example.ilibrary.config.AppConfig;
import com.example.ilibrary.metadata.LibraryMetadata.LibraryInfo;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataQueryException;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataQueryService;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataRenderer;
import com.example.ilibrary.metadata.LibraryMetadata.ObjectRow;
import com.example.ilibrary.savefile.SaveFiles.SaveFileManager;
import com.example.ilibrary.session.HostSession;
import com.example.ilibrary.session.HostSession.Credentials;
import com.example.ilibrary.transfer.SecureTransfer.SftpTransferSession;
import com.example.ilibrary.transfer.SecureTransfer.TransferSession;
import com.jcraft.jsch.JSch;

/**
 * Ponto de entrada para quem usa a biblioteca: backup, remoção de save file e
 * consultas de metadados sobre uma única sessão com o host.
 *
 * Criado com {@link #open(AppConfig)} (a conexão pertence ao cliente e é
 * fechada em {@link #close()}) ou com {@link #borrowing(Connection, Credentials)}
 * (a conexão continua de quem chama).
 *
 * Não é thread-safe: uma operação por vez por cliente.
 */
public final class LibraryClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LibraryClient.class);

    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 30_000;

    private final HostSession session;
    private final AppConfig config;
    private final BackupCoordinator coordinator;
    private final SaveFileManager saveFiles;
    private final MetadataQueryService metadata;
    private final MetadataRenderer renderer;

    LibraryClient(HostSession session, AppConfig config, TransferSession transfer, MetadataRenderer renderer) {
        this.session = Objects.requireNonNull(session, "session");
        this.config = config;
        this.saveFiles = new SaveFileManager(session.commands());
        this.coordinator = new BackupCoordinator(session.commands(), saveFiles,
                Objects.requireNonNull(transfer, "transfer"), session.credentials());
        this.metadata = new MetadataQueryService(session);
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Abre a conexão descrita pela configuração.
     */
    public static LibraryClient open(AppConfig config) throws SQLException {
        Objects.requireNonNull(config, "config");
        HostSession session = HostSession.open(config);
        return new LibraryClient(session, config, new SftpTransferSession(config), new MetadataRenderer());
    }

    /**
     * Usa uma conexão já aberta. {@link #close()} não a fecha.
     */
    public static LibraryClient borrowing(Connection connection, Credentials credentials) {
        HostSession session = HostSession.borrow(connection, credentials);
        TransferSession transfer = new SftpTransferSession(JSch::new, DEFAULT_CONNECT_TIMEOUT_MS, false, null);
        return new LibraryClient(session, null, transfer, new MetadataRenderer());
    }

    /**
     * Builder de backup já preenchido com os padrões da configuração
     * (diretórios, porta SSH e release de destino), quando houver.
     */
    public BackupRequest.Builder newRequest(String library, String saveFileName) {
        BackupRequest.Builder builder = BackupRequest.builder(library, saveFileName);
        if (config != null) {
            config.remoteDirectory().ifPresent(builder::remoteDirectory);
            config.localDirectory().ifPresent(builder::localDirectory);
            builder.port(config.sshPort());
            builder.targetRelease(config.targetRelease());
        }
        return builder;
    }

    /**
     * Salva a biblioteca em um save file e, se pedido, baixa o arquivo.
     *
     * @throws DownloadFailedException se o download falhar (o stream file fica no IFS)
     * @throws SaveFileRemovalException se o save file não puder ser removido após o download
     */
    public BackupResult saveLibrary(BackupRequest request) throws DownloadFailedException, SaveFileRemovalException {
        return coordinator.run(request);
    }

    /**
     * Remove um save file. Retorna false quando o host recusa o comando; a
     * conexão já passou por rollback.
     */
    public boolean removeFile(String library, String saveFileName) {
        try {
            saveFiles.remove(library, saveFileName);
            return true;
        } catch (CommandException e) {
            log.warn("Save file {}/{} não removido: {}", library, saveFileName, e.getMessage());
            return false;
        }
    }

    /** Atributos da biblioteca em JSON, ou o objeto de erro quando ela não existe. */
    public String getInfoForLibrary(String library) throws MetadataQueryException {
        return renderer.libraryInfo(library, metadata.libraryInfo(library));
    }

    public Optional<LibraryInfo> libraryInfo(String library) throws MetadataQueryException {
        return metadata.libraryInfo(library);
    }

    /**
     * Objetos da biblioteca em JSON. Com {@code qFiles}, somente membros de
     * arquivos fonte.
     */
    public String getFileInfo(String library, boolean qFiles) throws MetadataQueryException {
        return renderer.objects(library, metadata.objects(library, qFiles));
    }

    public List<? extends ObjectRow> objects(String library, boolean qFiles) throws MetadataQueryException {
        return metadata.objects(library, qFiles);
    }

    public HostSession session() { return session; }

    @Override
    public void close() throws SQLException {
        session.close();
    }
}
