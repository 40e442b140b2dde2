package com.example.ilibrary.session;

import java.sql.Connection;

import com.example.ilibrary.session.HostSession.Credentials;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HostSessionTest {

    private static final Credentials CREDENTIALS = new Credentials("pub400.com", "USER", "secret");

    @Mock
    private Connection connection;

    @Test
    void conexao_emprestada_nunca_e_fechada() throws Exception {
        // given
        HostSession session = HostSession.borrow(connection, CREDENTIALS);

        // when
        session.close();

        // then
        assertThat(session.ownsConnection()).isFalse();
        assertThat(session.isClosed()).isTrue();
        verify(connection, never()).close();
    }

    @Test
    void sessao_encerrada_nao_entrega_conexao_nem_canal() throws Exception {
        // given
        HostSession session = HostSession.borrow(connection, CREDENTIALS);
        session.close();

        // when / then
        assertThatThrownBy(session::connection).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::commands).isInstanceOf(IllegalStateException.class);
        assertThat(session.credentials()).isEqualTo(CREDENTIALS);
    }

    @Test
    void close_e_idempotente() throws Exception {
        HostSession session = HostSession.borrow(connection, CREDENTIALS);

        session.close();
        session.close();

        verifyNoInteractions(connection);
    }

    @Test
    void credenciais_validam_host_e_usuario_e_escondem_a_senha() {
        assertThatThrownBy(() -> new Credentials(" ", "USER", "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Credentials("host", null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(CREDENTIALS.toString()).doesNotContain("secret");
    }
}
