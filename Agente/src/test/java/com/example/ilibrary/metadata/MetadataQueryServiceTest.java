package com.example.ilibrary.metadata;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import com.example.ilibrary.metadata.LibraryMetadata.LibraryInfo;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataQueryException;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataQueryService;
import com.example.ilibrary.metadata.LibraryMetadata.MetadataRenderer;
import com.example.ilibrary.metadata.LibraryMetadata.ObjectRow;
import com.example.ilibrary.metadata.LibraryMetadata.ObjectStatistics;
import com.example.ilibrary.metadata.LibraryMetadata.SourceMemberStatistics;
import com.example.ilibrary.session.HostSession;
import com.example.ilibrary.session.HostSession.Credentials;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetadataQueryServiceTest {

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private ResultSetMetaData metaData;

    private MetadataQueryService service;

    @BeforeEach
    void setUp() {
        service = new MetadataQueryService(
                HostSession.borrow(connection, new Credentials("pub400.com", "USER", "secret")));
    }

    private void givenRows(String sql, int columns, Object[]... rows) throws SQLException {
        when(connection.prepareStatement(sql)).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(columns);
        int[] cursor = {-1};
        when(resultSet.next()).thenAnswer(inv -> ++cursor[0] < rows.length);
        lenient().when(resultSet.getObject(anyInt())).thenAnswer(inv -> {
            Object[] row = rows[cursor[0]];
            int index = inv.getArgument(0);
            return index <= row.length ? row[index - 1] : null;
        });
    }

    @Test
    void libraryInfo_mapeia_as_colunas_por_posicao() throws Exception {
        // given
        Object[] row = new Object[LibraryInfo.COLUMNS];
        row[0] = 42;
        row[1] = new BigDecimal("1048576");
        row[2] = "YES";
        row[3] = "PROD      ";
        row[4] = "Biblioteca de teste";
        row[6] = 1;
        row[14] = Timestamp.valueOf(LocalDateTime.of(2024, 3, 1, 10, 15));
        givenRows(MetadataQueryService.LIBRARY_INFO_SQL, LibraryInfo.COLUMNS, row);

        // when
        Optional<LibraryInfo> info = service.libraryInfo("akansha231");

        // then
        verify(statement).setString(1, "AKANSHA231");
        assertThat(info).hasValueSatisfying(i -> {
            assertThat(i.objectCount()).isEqualTo(42L);
            assertThat(i.librarySize()).isEqualTo(1_048_576L);
            assertThat(i.libraryType()).isEqualTo("PROD");
            assertThat(i.textDescription()).isEqualTo("Biblioteca de teste");
            assertThat(i.iaspName()).isNull();
            assertThat(i.iaspNumber()).isEqualTo(1L);
            assertThat(i.journalStartTimestamp()).isEqualTo("2024-03-01T10:15:00");
        });
        verify(resultSet).close();
        verify(statement).close();
    }

    @Test
    void libraryInfo_sem_linhas_e_vazio() throws Exception {
        // given
        givenRows(MetadataQueryService.LIBRARY_INFO_SQL, LibraryInfo.COLUMNS);

        // when / then
        assertThat(service.libraryInfo("NOLIB")).isEmpty();
    }

    @Test
    void objetos_da_biblioteca() throws Exception {
        // given
        givenRows(MetadataQueryService.OBJECT_STATISTICS_SQL, ObjectStatistics.COLUMNS,
                new Object[]{"TESTFI1E", "*FILE", "QSECOFR", "QSECOFR", null, 540672L},
                new Object[]{"PGM1", "*PGM", "USER"});

        // when
        List<? extends ObjectRow> rows = service.objects("AKANSHA231", false);

        // then
        assertThat(rows).hasSize(2).allMatch(r -> r instanceof ObjectStatistics);
        ObjectStatistics first = (ObjectStatistics) rows.get(0);
        assertThat(first.objname()).isEqualTo("TESTFI1E");
        assertThat(first.objtype()).isEqualTo("*FILE");
        assertThat(first.objsize()).isEqualTo(540_672L);
        assertThat(((ObjectStatistics) rows.get(1)).objsize()).isNull();
    }

    @Test
    void membros_fonte_com_menos_colunas_que_o_registro() throws Exception {
        // given
        Object[] row = new Object[SourceMemberStatistics.COLUMNS];
        row[0] = "AKANSHA231";
        row[4] = "HELLO";
        row[5] = "RPGLE";
        givenRows(MetadataQueryService.SOURCE_MEMBERS_SQL, 10, row);

        // when
        List<SourceMemberStatistics> rows = service.sourceMembers("AKANSHA231");

        // then
        assertThat(rows).singleElement().satisfies(m -> {
            assertThat(m.systemTableMember()).isEqualTo("HELLO");
            assertThat(m.sourceType()).isEqualTo("RPGLE");
            assertThat(m.sequentialReads()).isNull();
            assertThat(m.randomReads()).isNull();
        });
    }

    @Test
    void coluna_volatile_do_membro_chega_ao_json_com_o_nome_da_coluna() throws Exception {
        // given
        Object[] row = new Object[SourceMemberStatistics.COLUMNS];
        row[0] = "AKANSHA231";
        row[4] = "HELLO";
        row[55] = "YES       ";
        givenRows(MetadataQueryService.SOURCE_MEMBERS_SQL, SourceMemberStatistics.COLUMNS, row);

        // when
        List<SourceMemberStatistics> rows = service.sourceMembers("AKANSHA231");
        JsonNode json = new ObjectMapper().readTree(new MetadataRenderer().objects("AKANSHA231", rows));

        // then
        assertThat(rows).singleElement().satisfies(m -> assertThat(m.volatileValue()).isEqualTo("YES"));
        assertThat(json.get(0).get("VOLATILE").asText()).isEqualTo("YES");
        assertThat(json.get(0).has("volatileValue")).isFalse();
    }

    @Test
    void contador_decimal_exato_vira_long() throws Exception {
        // given
        Object[] row = new Object[LibraryInfo.COLUMNS];
        row[0] = new BigDecimal("42.00");
        row[1] = "9223372036854775807";
        givenRows(MetadataQueryService.LIBRARY_INFO_SQL, LibraryInfo.COLUMNS, row);

        // when
        Optional<LibraryInfo> info = service.libraryInfo("AKANSHA231");

        // then
        assertThat(info).hasValueSatisfying(i -> {
            assertThat(i.objectCount()).isEqualTo(42L);
            assertThat(i.librarySize()).isEqualTo(Long.MAX_VALUE);
        });
    }

    @Test
    void contador_fora_do_intervalo_de_long_falha_em_vez_de_truncar() throws Exception {
        // given
        Object[] row = new Object[LibraryInfo.COLUMNS];
        row[0] = 1;
        row[1] = new BigDecimal("12345678901234567890123.75");
        givenRows(MetadataQueryService.LIBRARY_INFO_SQL, LibraryInfo.COLUMNS, row);

        // when / then
        assertThatThrownBy(() -> service.libraryInfo("AKANSHA231"))
                .isInstanceOfSatisfying(MetadataQueryException.class,
                        e -> assertThat(e.library()).isEqualTo("AKANSHA231"))
                .hasMessageContaining("12345678901234567890123.75");
    }

    @Test
    void contador_com_fracao_falha_em_vez_de_truncar() throws Exception {
        // given
        Object[] row = new Object[LibraryInfo.COLUMNS];
        row[0] = "7.5";
        givenRows(MetadataQueryService.LIBRARY_INFO_SQL, LibraryInfo.COLUMNS, row);

        // when / then
        assertThatThrownBy(() -> service.libraryInfo("AKANSHA231"))
                .isInstanceOf(MetadataQueryException.class);
    }

    @Test
    void erro_sql_vira_MetadataQueryException() throws Exception {
        // given
        when(connection.prepareStatement(MetadataQueryService.OBJECT_STATISTICS_SQL))
                .thenThrow(new SQLException("SQL0204 não encontrado", "42704"));

        // when / then
        assertThatThrownBy(() -> service.objectStatistics("NOLIB"))
                .isInstanceOfSatisfying(MetadataQueryException.class, e -> {
                    assertThat(e.library()).isEqualTo("NOLIB");
                    assertThat(e.sqlState()).isEqualTo("42704");
                });
    }

    @Test
    void nome_invalido_nao_consulta_o_host() {
        assertThatThrownBy(() -> service.libraryInfo("BIBLIOTECA11"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(connection);
    }
}
