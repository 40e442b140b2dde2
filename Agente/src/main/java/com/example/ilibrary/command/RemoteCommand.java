package com.example.ilibrary.command;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canal de comandos remotos: texto CL executado no host via QSYS2.QCMDEXC.
 */
public final class RemoteCommand {

    private RemoteCommand() {}

    /**
     * Envia um comando por chamada e reporta sucesso/falha.
     *
     * commit/rollback são contabilidade sobre a conexão: comandos CL não são
     * transacionais, então um rollback não desfaz um comando parcialmente aplicado.
     */
    public interface CommandChannel {

        /**
         * Executa exatamente um comando.
         *
         * @throws IllegalArgumentException se o texto estiver vazio
         * @throws CommandException se o host rejeitar ou a chamada falhar
         */
        void execute(String commandText) throws CommandException;

        void commit() throws CommandException;

        /** Nunca lança: falhas de rollback não podem mascarar o erro original. */
        void rollback();
    }

    /**
     * Implementação sobre uma conexão JDBC já aberta (Toolbox for Java).
     * Não é dona da conexão e nunca a fecha.
     */
    public static final class QcmdexcChannel implements CommandChannel {
        private static final Logger log = LoggerFactory.getLogger(QcmdexcChannel.class);
        static final String CALL_QCMDEXC = "CALL QSYS2.QCMDEXC(?)";

        private final Connection connection;

        public QcmdexcChannel(Connection connection) {
            this.connection = Objects.requireNonNull(connection, "connection");
        }

        @Override
        public void execute(String commandText) throws CommandException {
            if (commandText == null || commandText.isBlank()) {
                throw new IllegalArgumentException("Texto do comando obrigatório.");
            }
            log.debug("QCMDEXC: {}", commandText);
            try (PreparedStatement statement = connection.prepareStatement(CALL_QCMDEXC)) {
                statement.setString(1, commandText);
                statement.execute();
            } catch (SQLException e) {
                throw new CommandException(commandText, e);
            }
        }

        @Override
        public void commit() throws CommandException {
            try {
                if (connection.getAutoCommit()) {
                    return;
                }
                connection.commit();
            } catch (SQLException e) {
                throw new CommandException("COMMIT", e);
            }
        }

        @Override
        public void rollback() {
            try {
                if (connection.getAutoCommit()) {
                    return;
                }
                connection.rollback();
            } catch (SQLException e) {
                log.warn("Falha no rollback da conexão de comandos: {}", e.toString());
            }
        }
    }

    /**
     * Falha de despacho/execução de um comando remoto. Carrega o texto do comando
     * e, quando disponível, o SQLSTATE e a mensagem do host.
     */
    public static final class CommandException extends IOException {
        private final String command;
        private final String sqlState;

        public CommandException(String command, SQLException cause) {
            super("Falha ao executar comando [" + command + "]: " + (cause != null ? cause.getMessage() : "erro desconhecido"), cause);
            this.command = command;
            this.sqlState = cause != null ? cause.getSQLState() : null;
        }

        public CommandException(String command, String message) {
            super("Falha ao executar comando [" + command + "]: " + message);
            this.command = command;
            this.sqlState = null;
        }

        public String command() { return command; }
        public String sqlState() { return sqlState; }
    }
}
