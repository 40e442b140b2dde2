package com.example.ilibrary;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.example.ilibrary.Main.Invocation;
import com.example.ilibrary.backup.Backup.BackupRequest;
import com.example.ilibrary.backup.Backup.BackupResult;
import com.example.ilibrary.backup.Backup.BackupState;
import com.example.ilibrary.backup.Backup.DownloadFailedException;
import com.example.ilibrary.library.LibraryClient;
import com.example.ilibrary.transfer.SecureTransfer.TransferException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MainTest {

    @Mock
    private LibraryClient client;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    // ============================================================
    // 1. Linha de comando
    // ============================================================

    @Test
    void parse_save_com_opcoes() {
        Invocation invocation = Main.parse(new String[]{
                "save", "AKANSHA231", "TESTFI1E", "--download", "--remote-dir", "/home/user/", "--port", "22"});

        assertThat(invocation.command()).isEqualTo("save");
        assertThat(invocation.arguments()).containsExactly("AKANSHA231", "TESTFI1E");
        assertThat(invocation.options())
                .containsEntry("download", "true")
                .containsEntry("remote-dir", "/home/user/")
                .containsEntry("port", "22");
    }

    @Test
    void parse_rejeita_comando_aridade_e_opcoes_invalidas() {
        assertThatThrownBy(() -> Main.parse(new String[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.parse(new String[]{"restore", "LIB"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.parse(new String[]{"info"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.parse(new String[]{"info", "LIB", "--download"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.parse(new String[]{"save", "LIB", "SAVF", "--port"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.parse(new String[]{"save", "LIB", "SAVF", "--zip"})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void comando_invalido_devolve_codigo_de_uso_sem_conectar() throws Exception {
        int code = new Main().run(new String[]{"info"}, out);

        assertThat(code).isEqualTo(Main.EXIT_USAGE);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("Uso:");
    }

    @Test
    void toRequest_aplica_as_opcoes_sobre_o_builder_do_cliente() {
        // given
        when(client.newRequest("AKANSHA231", "TESTFI1E")).thenReturn(BackupRequest.builder("AKANSHA231", "TESTFI1E"));
        Invocation invocation = Main.parse(new String[]{"save", "AKANSHA231", "TESTFI1E",
                "--download", "--remote-dir", "/home/user/", "--local-dir", "/tmp/bk", "--keep-savf"});

        // when
        BackupRequest request = Main.toRequest(invocation, client);

        // then
        assertThat(request.remoteStreamFile()).isEqualTo("/home/user/TESTFI1E.savf");
        assertThat(request.transfer().orElseThrow().deleteRemoteAfterTransfer()).isFalse();
        assertThat(request.transfer().orElseThrow().deleteArchiveContainerAfterTransfer()).isFalse();
    }

    @Test
    void toRequest_sem_keep_savf_remove_o_save_file_apos_o_download() {
        // given
        when(client.newRequest("AKANSHA231", "TESTFI1E")).thenReturn(BackupRequest.builder("AKANSHA231", "TESTFI1E"));
        Invocation invocation = Main.parse(new String[]{"save", "AKANSHA231", "TESTFI1E",
                "--download", "--remote-dir", "/home/user", "--local-dir", "/tmp/bk"});

        // when
        BackupRequest request = Main.toRequest(invocation, client);

        // then
        assertThat(request.transfer().orElseThrow().deleteRemoteAfterTransfer()).isTrue();
    }

    @Test
    void opcao_keep_stream_file_nao_existe_mais() {
        assertThatThrownBy(() -> Main.parse(new String[]{"save", "LIB", "SAVF", "--keep-stream-file"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 2. Execução
    // ============================================================

    @Test
    void save_com_sucesso_imprime_o_arquivo_local() throws Exception {
        // given
        when(client.newRequest("LIB", "SAVF")).thenReturn(BackupRequest.builder("LIB", "SAVF"));
        when(client.saveLibrary(any())).thenReturn(new BackupResult(BackupState.DONE,
                List.of(BackupState.INIT, BackupState.DONE), Path.of("/tmp/SAVF.savf"), List.of(), null));

        // when
        int code = new Main().execute(Main.parse(new String[]{"save", "LIB", "SAVF"}), client, out);

        // then
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("SAVF.savf");
    }

    @Test
    void falha_no_download_devolve_codigo_de_falha() throws Exception {
        // given
        when(client.newRequest("LIB", "SAVF")).thenReturn(BackupRequest.builder("LIB", "SAVF"));
        when(client.saveLibrary(any())).thenThrow(new DownloadFailedException(BackupState.POPULATED, "/home/u/SAVF.savf",
                new TransferException(TransferException.Reason.AUTHENTICATION_FAILED, "Auth fail", null)));

        // when
        int code = new Main().execute(Main.parse(new String[]{"save", "LIB", "SAVF"}), client, out);

        // then
        assertThat(code).isEqualTo(Main.EXIT_FAILED);
    }

    @Test
    void remove_recusado_devolve_codigo_de_falha() {
        // given
        when(client.removeFile("LIB", "SAVF")).thenReturn(false);

        // when / then
        assertThat(new Main().execute(Main.parse(new String[]{"remove", "LIB", "SAVF"}), client, out))
                .isEqualTo(Main.EXIT_FAILED);
    }

    @Test
    void members_imprime_o_json_dos_membros_fonte() throws Exception {
        // given
        when(client.getFileInfo("LIB", true)).thenReturn("[ ]");

        // when
        int code = new Main().execute(Main.parse(new String[]{"members", "LIB"}), client, out);

        // then
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("[ ]");
        verify(client, never()).getFileInfo("LIB", false);
    }
}
