package com.example.ilibrary.backup;

import java.nio.file.Path;

import com.example.ilibrary.backup.Backup.BackupRequest;
import com.example.ilibrary.backup.Backup.TransferOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupRequestTest {

    @Test
    void padroes_sem_download() {
        BackupRequest request = BackupRequest.builder("akansha231", "testfi1e").build();

        assertThat(request.library().value()).isEqualTo("AKANSHA231");
        assertThat(request.toLibrary()).isEqualTo(request.library());
        assertThat(request.description()).isEqualTo("A SaveFile from iLibrary");
        assertThat(request.targetRelease()).isEqualTo("*CURRENT");
        assertThat(request.download()).isFalse();
        assertThat(request.transfer()).isEmpty();
        assertThat(request.removeSaveFileOnPopulateFailure()).isFalse();
        assertThat(request.saveFilePath()).isEqualTo("/QSYS.LIB/AKANSHA231.LIB/TESTFI1E.FILE");
    }

    @Test
    void barra_final_e_removida_uma_vez() {
        BackupRequest request = BackupRequest.builder("AKANSHA231", "TESTFI1E")
                .download("/home/user/", "/tmp/backups/")
                .build();

        assertThat(request.remoteStreamFile()).isEqualTo("/home/user/TESTFI1E.savf");
        assertThat(request.localFile()).isEqualTo(Path.of("/tmp/backups/TESTFI1E.savf"));
        assertThat(BackupRequest.Builder.stripTrailingSlash("/a//")).isEqualTo("/a/");
    }

    @Test
    void opcoes_de_transferencia_padrao() {
        TransferOptions options = BackupRequest.builder("LIB", "SAVF")
                .download("/home/u", "/tmp")
                .build()
                .transfer()
                .orElseThrow();

        assertThat(options.port()).isEqualTo(2222);
        assertThat(options.deleteRemoteAfterTransfer()).isTrue();
        assertThat(options.deleteArchiveContainerAfterTransfer()).isTrue();
    }

    @Test
    void porta_zero_ou_negativa_e_rejeitada_em_vez_de_cair_na_padrao() {
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").download("/home/u", "/tmp").port(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0");
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").download("/home/u", "/tmp").port(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void porta_nos_limites_e_aceita() {
        assertThat(BackupRequest.builder("LIB", "SAVF").download("/home/u", "/tmp").port(1).build()
                .transfer().orElseThrow().port()).isEqualTo(1);
        assertThat(BackupRequest.builder("LIB", "SAVF").download("/home/u", "/tmp").port(65535).build()
                .transfer().orElseThrow().port()).isEqualTo(65535);
    }

    @Test
    void download_exige_os_dois_diretorios() {
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").download(true).localDirectory("/tmp").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").download(true).remoteDirectory("/home").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void diretorios_sem_download_sao_ignorados() {
        BackupRequest request = BackupRequest.builder("LIB", "SAVF")
                .remoteDirectory("/home/u")
                .localDirectory("/tmp")
                .build();

        assertThat(request.download()).isFalse();
        assertThatThrownBy(request::remoteStreamFile).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void argumentos_invalidos() {
        assertThatThrownBy(() -> BackupRequest.builder("BIBLIOTECA11", "SAVF").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").toLibrary("LONGLIBRARY1").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").targetRelease("latest").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").download("/home/a b", "/tmp").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackupRequest.builder("LIB", "SAVF").download("/home", "/tmp").port(70000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
