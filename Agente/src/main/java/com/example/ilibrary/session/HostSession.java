package com.example.ilibrary.session;

import com.example.ilibrary.command.RemoteCommand.CommandChannel;
import com.example.ilibrary.command.RemoteCommand.QcmdexcChannel;
import com.example.ilibrary.config.AppConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sessão com o host IBM i.
 *
 * Responsabilidade:
 *  - manter a única conexão de comandos (JDBC) usada durante uma orquestração,
 *  - guardar as credenciais reutilizadas pela sessão SFTP efêmera,
 *  - fechar a conexão apenas quando ela foi aberta aqui.
 *
 * Uma sessão atende uma orquestração por vez; coordenar chamadas concorrentes é
 * responsabilidade de quem chama.
 */
public final class HostSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HostSession.class);

    private final Connection connection;
    private final Credentials credentials;
    private final boolean ownsConnection;
    private final CommandChannel commands;
    private volatile boolean closed;

    private HostSession(Connection connection, Credentials credentials, boolean ownsConnection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.ownsConnection = ownsConnection;
        this.commands = new QcmdexcChannel(connection);
    }

    /**
     * Abre uma conexão nova com base na configuração. A sessão passa a ser dona
     * da conexão e a fecha em {@link #close()}.
     */
    public static HostSession open(AppConfig config) throws SQLException {
        Objects.requireNonNull(config, "config");
        Credentials credentials = new Credentials(config.host(), config.user(), config.password());
        DriverManager.setLoginTimeout(config.loginTimeoutSeconds());
        Connection connection = DriverManager.getConnection(config.jdbcUrl(), credentials.user(), credentials.password());
        try {
            connection.setAutoCommit(config.autoCommit());
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        log.info("Conexão aberta com {} (usuário {}, autoCommit={})", credentials.host(), credentials.user(), config.autoCommit());
        return new HostSession(connection, credentials, true);
    }

    /**
     * Usa uma conexão aberta por quem chama. {@link #close()} nunca a fecha.
     */
    public static HostSession borrow(Connection connection, Credentials credentials) {
        return new HostSession(connection, credentials, false);
    }

    public Connection connection() {
        requireOpen();
        return connection;
    }

    public CommandChannel commands() {
        requireOpen();
        return commands;
    }

    public Credentials credentials() { return credentials; }

    public boolean ownsConnection() { return ownsConnection; }

    public boolean isClosed() { return closed; }

    /**
     * Fecha a conexão se for dona dela; no modo emprestado apenas marca a sessão
     * como encerrada.
     */
    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        if (ownsConnection && !connection.isClosed()) {
            connection.close();
            log.info("Conexão com {} encerrada.", credentials.host());
        }
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Sessão com o host já encerrada");
        }
    }

    /**
     * Credenciais do host. toString() nunca expõe a senha.
     */
    public static record Credentials(String host, String user, String password) {
        public Credentials {
            if (host == null || host.isBlank()) throw new IllegalArgumentException("Host obrigatório.");
            if (user == null || user.isBlank()) throw new IllegalArgumentException("Usuário obrigatório.");
            Objects.requireNonNull(password, "password");
        }

        @Override
        public String toString() {
            return "Credentials{host=" + host + ", user=" + user + ", password=***}";
        }
    }
}
