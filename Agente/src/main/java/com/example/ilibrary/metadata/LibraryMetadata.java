package com.example.ilibrary.metadata;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.ilibrary.command.ClCommands.ObjectName;
import com.example.ilibrary.session.HostSession;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Consultas somente leitura sobre bibliotecas e objetos do host, e a
 * renderização JSON dos resultados.
 */
public final class LibraryMetadata {

    private LibraryMetadata() {}

    /**
     * Executa as consultas de catálogo na conexão da sessão. Nenhuma consulta
     * altera estado no host. O nome da biblioteca vai sempre como parâmetro.
     */
    public static final class MetadataQueryService {
        private static final Logger log = LoggerFactory.getLogger(MetadataQueryService.class);

        static final String LIBRARY_INFO_SQL =
                "SELECT * FROM TABLE(QSYS2.LIBRARY_INFO(UPPER(?)))";
        static final String OBJECT_STATISTICS_SQL =
                "SELECT * FROM TABLE(QSYS2.OBJECT_STATISTICS(?, '*ALL')) X";
        static final String SOURCE_MEMBERS_SQL =
                "SELECT * FROM QSYS2.SYSMEMBERSTAT WHERE SYSTEM_TABLE_SCHEMA = ? AND SOURCE_TYPE IS NOT NULL"
                + " ORDER BY SYSTEM_TABLE_MEMBER";

        private final HostSession session;

        public MetadataQueryService(HostSession session) {
            this.session = Objects.requireNonNull(session, "session");
        }

        /**
         * Atributos da biblioteca, ou vazio quando o host não devolve linha.
         */
        public Optional<LibraryInfo> libraryInfo(String library) throws MetadataQueryException {
            ObjectName name = ObjectName.of(library, "biblioteca");
            List<LibraryInfo> rows = query(LIBRARY_INFO_SQL, name, LibraryInfo::read);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }

        /** Todos os objetos da biblioteca (QSYS2.OBJECT_STATISTICS). */
        public List<ObjectStatistics> objectStatistics(String library) throws MetadataQueryException {
            return query(OBJECT_STATISTICS_SQL, ObjectName.of(library, "biblioteca"), ObjectStatistics::read);
        }

        /** Somente membros de arquivos fonte (QSYS2.SYSMEMBERSTAT). */
        public List<SourceMemberStatistics> sourceMembers(String library) throws MetadataQueryException {
            return query(SOURCE_MEMBERS_SQL, ObjectName.of(library, "biblioteca"), SourceMemberStatistics::read);
        }

        public List<? extends ObjectRow> objects(String library, boolean sourceMembersOnly) throws MetadataQueryException {
            return sourceMembersOnly ? sourceMembers(library) : objectStatistics(library);
        }

        private <T> List<T> query(String sql, ObjectName library, RowMapper<T> mapper) throws MetadataQueryException {
            Connection connection = session.connection();
            log.debug("Consulta de metadados para {}: {}", library, sql);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, library.value());
                try (ResultSet rs = statement.executeQuery()) {
                    RowReader reader = new RowReader(rs);
                    List<T> rows = new ArrayList<>();
                    while (rs.next()) {
                        rows.add(mapper.map(reader));
                    }
                    log.debug("{} linha(s) para {}", rows.size(), library);
                    return rows;
                }
            } catch (SQLException e) {
                throw new MetadataQueryException(library.value(), e);
            }
        }
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(RowReader row) throws SQLException;
    }

    /**
     * Leitura posicional de uma linha. Colunas além das devolvidas pelo host
     * viram null; datas saem em ISO-8601 e decimais sem notação científica.
     */
    static final class RowReader {
        private final ResultSet rs;
        private final int columnCount;

        RowReader(ResultSet rs) throws SQLException {
            this.rs = rs;
            this.columnCount = rs.getMetaData().getColumnCount();
        }

        String text(int index) throws SQLException {
            if (index > columnCount) {
                return null;
            }
            Object value = rs.getObject(index);
            if (value == null) {
                return null;
            }
            if (value instanceof Timestamp) {
                return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(((Timestamp) value).toLocalDateTime());
            }
            if (value instanceof java.sql.Date) {
                return ((java.sql.Date) value).toLocalDate().toString();
            }
            if (value instanceof Time) {
                return DateTimeFormatter.ISO_LOCAL_TIME.format(((Time) value).toLocalTime());
            }
            if (value instanceof LocalDateTime) {
                return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value);
            }
            if (value instanceof TemporalAccessor) {
                return value.toString();
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toPlainString();
            }
            if (value instanceof String) {
                // CHAR do host vem completado com brancos
                return ((String) value).stripTrailing();
            }
            return value.toString();
        }

        Long number(int index) throws SQLException {
            if (index > columnCount) {
                return null;
            }
            Object value = rs.getObject(index);
            if (value == null) {
                return null;
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            BigDecimal decimal;
            if (value instanceof BigDecimal) {
                decimal = (BigDecimal) value;
            } else if (value instanceof BigInteger) {
                decimal = new BigDecimal((BigInteger) value);
            } else {
                String text = value.toString().trim();
                if (text.isEmpty()) {
                    return null;
                }
                try {
                    decimal = new BigDecimal(text);
                } catch (NumberFormatException e) {
                    throw new SQLException("Valor numérico inválido na coluna " + index + ": " + text, e);
                }
            }
            try {
                // fração ou estouro de long não podem virar contador silenciosamente
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                throw new SQLException("Valor da coluna " + index + " não cabe em um inteiro de 64 bits: "
                        + decimal.toPlainString(), e);
            }
        }
    }

    /** Linha de listagem de objetos: estatística de objeto ou de membro fonte. */
    public interface ObjectRow {
    }

    /**
     * Linha de QSYS2.LIBRARY_INFO.
     */
    public static record LibraryInfo(
            @JsonProperty("OBJECT_COUNT") Long objectCount,
            @JsonProperty("LIBRARY_SIZE") Long librarySize,
            @JsonProperty("LIBRARY_SIZE_COMPLETE") String librarySizeComplete,
            @JsonProperty("LIBRARY_TYPE") String libraryType,
            @JsonProperty("TEXT_DESCRIPTION") String textDescription,
            @JsonProperty("IASP_NAME") String iaspName,
            @JsonProperty("IASP_NUMBER") Long iaspNumber,
            @JsonProperty("CREATE_AUTHORITY") String createAuthority,
            @JsonProperty("OBJECT_AUDIT_CREATE") String objectAuditCreate,
            @JsonProperty("JOURNALED") String journaled,
            @JsonProperty("JOURNAL_LIBRARY") String journalLibrary,
            @JsonProperty("JOURNAL_NAME") String journalName,
            @JsonProperty("INHERIT_JOURNALING") String inheritJournaling,
            @JsonProperty("JOURNAL_INHERIT_RULES") String journalInheritRules,
            @JsonProperty("JOURNAL_START_TIMESTAMP") String journalStartTimestamp,
            @JsonProperty("APPLY_STARTING_RECEIVER_LIBRARY") String applyStartingReceiverLibrary,
            @JsonProperty("APPLY_STARTING_RECEIVER") String applyStartingReceiver,
            @JsonProperty("APPLY_STARTING_RECEIVER_ASP") String applyStartingReceiverAsp) {

        public static final int COLUMNS = 18;

        static LibraryInfo read(RowReader row) throws SQLException {
            return new LibraryInfo(
                    row.number(1),
                    row.number(2),
                    row.text(3),
                    row.text(4),
                    row.text(5),
                    row.text(6),
                    row.number(7),
                    row.text(8),
                    row.text(9),
                    row.text(10),
                    row.text(11),
                    row.text(12),
                    row.text(13),
                    row.text(14),
                    row.text(15),
                    row.text(16),
                    row.text(17),
                    row.text(18));
        }
    }

    /**
     * Linha de QSYS2.OBJECT_STATISTICS(lib, '*ALL').
     */
    public static record ObjectStatistics(
            @JsonProperty("OBJNAME") String objname,
            @JsonProperty("OBJTYPE") String objtype,
            @JsonProperty("OBJOWNER") String objowner,
            @JsonProperty("OBJDEFINER") String objdefiner,
            @JsonProperty("OBJCREATED") String objcreated,
            @JsonProperty("OBJSIZE") Long objsize,
            @JsonProperty("OBJTEXT") String objtext,
            @JsonProperty("OBJLONGNAME") String objlongname,
            @JsonProperty("LAST_USED_TIMESTAMP") String lastUsedTimestamp,
            @JsonProperty("LAST_USED_OBJECT") String lastUsedObject,
            @JsonProperty("DAYS_USED_COUNT") Long daysUsedCount,
            @JsonProperty("LAST_RESET_TIMESTAMP") String lastResetTimestamp,
            @JsonProperty("IASP_NUMBER") Long iaspNumber,
            @JsonProperty("IASP_NAME") String iaspName,
            @JsonProperty("OBJATTRIBUTE") String objattribute,
            @JsonProperty("OBJLONGSCHEMA") String objlongschema,
            @JsonProperty("TEXT") String text,
            @JsonProperty("SQL_OBJECT_TYPE") String sqlObjectType,
            @JsonProperty("OBJLIB") String objlib,
            @JsonProperty("CHANGE_TIMESTAMP") String changeTimestamp,
            @JsonProperty("USER_CHANGED") String userChanged,
            @JsonProperty("SOURCE_FILE") String sourceFile,
            @JsonProperty("SOURCE_LIBRARY") String sourceLibrary,
            @JsonProperty("SOURCE_MEMBER") String sourceMember,
            @JsonProperty("SOURCE_TIMESTAMP") String sourceTimestamp,
            @JsonProperty("CREATED_SYSTEM") String createdSystem,
            @JsonProperty("CREATED_SYSTEM_VERSION") String createdSystemVersion,
            @JsonProperty("LICENSED_PROGRAM") String licensedProgram,
            @JsonProperty("LICENSED_PROGRAM_VERSION") String licensedProgramVersion,
            @JsonProperty("COMPILER") String compiler,
            @JsonProperty("COMPILER_VERSION") String compilerVersion,
            @JsonProperty("OBJECT_CONTROL_LEVEL") String objectControlLevel,
            @JsonProperty("BUILD_ID") String buildId,
            @JsonProperty("PTF_NUMBER") String ptfNumber,
            @JsonProperty("APAR_ID") String aparId,
            @JsonProperty("USER_DEFINED_ATTRIBUTE") String userDefinedAttribute,
            @JsonProperty("ALLOW_CHANGE_BY_PROGRAM") String allowChangeByProgram,
            @JsonProperty("CHANGED_BY_PROGRAM") String changedByProgram,
            @JsonProperty("COMPRESSED") String compressed,
            @JsonProperty("PRIMARY_GROUP") String primaryGroup,
            @JsonProperty("STORAGE_FREED") String storageFreed,
            @JsonProperty("ASSOCIATED_SPACE_SIZE") Long associatedSpaceSize,
            @JsonProperty("OPTIMUM_SPACE_ALIGNMENT") String optimumSpaceAlignment,
            @JsonProperty("OVERFLOW_STORAGE") String overflowStorage,
            @JsonProperty("OBJECT_DOMAIN") String objectDomain,
            @JsonProperty("OBJECT_AUDIT") String objectAudit,
            @JsonProperty("OBJECT_SIGNED") String objectSigned,
            @JsonProperty("SYSTEM_TRUSTED_SOURCE") String systemTrustedSource,
            @JsonProperty("MULTIPLE_SIGNATURES") String multipleSignatures,
            @JsonProperty("SAVE_TIMESTAMP") String saveTimestamp,
            @JsonProperty("RESTORE_TIMESTAMP") String restoreTimestamp,
            @JsonProperty("SAVE_WHILE_ACTIVE_TIMESTAMP") String saveWhileActiveTimestamp,
            @JsonProperty("SAVE_COMMAND") String saveCommand,
            @JsonProperty("SAVE_DEVICE") String saveDevice,
            @JsonProperty("SAVE_FILE_NAME") String saveFileName,
            @JsonProperty("SAVE_FILE_LIBRARY") String saveFileLibrary,
            @JsonProperty("SAVE_VOLUME") String saveVolume,
            @JsonProperty("SAVE_LABEL") String saveLabel,
            @JsonProperty("SAVE_SEQUENCE_NUMBER") Long saveSequenceNumber,
            @JsonProperty("LAST_SAVE_SIZE") Long lastSaveSize,
            @JsonProperty("JOURNALED") String journaled,
            @JsonProperty("JOURNAL_NAME") String journalName,
            @JsonProperty("JOURNAL_LIBRARY") String journalLibrary,
            @JsonProperty("JOURNAL_IMAGES") String journalImages,
            @JsonProperty("OMIT_JOURNAL_ENTRY") String omitJournalEntry,
            @JsonProperty("REMOTE_JOURNAL_FILTER") String remoteJournalFilter,
            @JsonProperty("JOURNAL_START_TIMESTAMP") String journalStartTimestamp,
            @JsonProperty("APPLY_STARTING_RECEIVER") String applyStartingReceiver,
            @JsonProperty("APPLY_STARTING_RECEIVER_LIBRARY") String applyStartingReceiverLibrary,
            @JsonProperty("AUTHORITY_COLLECTION_VALUE") String authorityCollectionValue) implements ObjectRow {

        public static final int COLUMNS = 70;

        static ObjectStatistics read(RowReader row) throws SQLException {
            return new ObjectStatistics(
                    row.text(1),
                    row.text(2),
                    row.text(3),
                    row.text(4),
                    row.text(5),
                    row.number(6),
                    row.text(7),
                    row.text(8),
                    row.text(9),
                    row.text(10),
                    row.number(11),
                    row.text(12),
                    row.number(13),
                    row.text(14),
                    row.text(15),
                    row.text(16),
                    row.text(17),
                    row.text(18),
                    row.text(19),
                    row.text(20),
                    row.text(21),
                    row.text(22),
                    row.text(23),
                    row.text(24),
                    row.text(25),
                    row.text(26),
                    row.text(27),
                    row.text(28),
                    row.text(29),
                    row.text(30),
                    row.text(31),
                    row.text(32),
                    row.text(33),
                    row.text(34),
                    row.text(35),
                    row.text(36),
                    row.text(37),
                    row.text(38),
                    row.text(39),
                    row.text(40),
                    row.text(41),
                    row.number(42),
                    row.text(43),
                    row.text(44),
                    row.text(45),
                    row.text(46),
                    row.text(47),
                    row.text(48),
                    row.text(49),
                    row.text(50),
                    row.text(51),
                    row.text(52),
                    row.text(53),
                    row.text(54),
                    row.text(55),
                    row.text(56),
                    row.text(57),
                    row.text(58),
                    row.number(59),
                    row.number(60),
                    row.text(61),
                    row.text(62),
                    row.text(63),
                    row.text(64),
                    row.text(65),
                    row.text(66),
                    row.text(67),
                    row.text(68),
                    row.text(69),
                    row.text(70));
        }
    }

    /**
     * Linha de QSYS2.SYSMEMBERSTAT para membros de arquivos fonte.
     */
    public static record SourceMemberStatistics(
            @JsonProperty("TABLE_SCHEMA") String tableSchema,
            @JsonProperty("TABLE_NAME") String tableName,
            @JsonProperty("SYSTEM_TABLE_SCHEMA") String systemTableSchema,
            @JsonProperty("SYSTEM_TABLE_NAME") String systemTableName,
            @JsonProperty("SYSTEM_TABLE_MEMBER") String systemTableMember,
            @JsonProperty("SOURCE_TYPE") String sourceType,
            @JsonProperty("LAST_SOURCE_UPDATE_TIMESTAMP") String lastSourceUpdateTimestamp,
            @JsonProperty("TEXT_DESCRIPTION") String textDescription,
            @JsonProperty("CREATE_TIMESTAMP") String createTimestamp,
            @JsonProperty("LAST_CHANGE_TIMESTAMP") String lastChangeTimestamp,
            @JsonProperty("LAST_SAVE_TIMESTAMP") String lastSaveTimestamp,
            @JsonProperty("LAST_RESTORE_TIMESTAMP") String lastRestoreTimestamp,
            @JsonProperty("LAST_USED_TIMESTAMP") String lastUsedTimestamp,
            @JsonProperty("DAYS_USED_COUNT") Long daysUsedCount,
            @JsonProperty("LAST_RESET_TIMESTAMP") String lastResetTimestamp,
            @JsonProperty("TABLE_PARTITION") String tablePartition,
            @JsonProperty("PARTITION_TYPE") String partitionType,
            @JsonProperty("PARTITION_NUMBER") Long partitionNumber,
            @JsonProperty("NUMBER_DISTRIBUTED_PARTITIONS") Long numberDistributedPartitions,
            @JsonProperty("NUMBER_PARTITIONING_KEYS") Long numberPartitioningKeys,
            @JsonProperty("PARTITIONING_KEYS") String partitioningKeys,
            @JsonProperty("LOWINCLUSIVE") String lowinclusive,
            @JsonProperty("LOWVALUE") String lowvalue,
            @JsonProperty("HIGHINCLUSIVE") String highinclusive,
            @JsonProperty("HIGHVALUE") String highvalue,
            @JsonProperty("NUMBER_ROWS") Long numberRows,
            @JsonProperty("NUMBER_PAGES") Long numberPages,
            @JsonProperty("OVERFLOW") Long overflow,
            @JsonProperty("AVGROWSIZE") Long avgrowsize,
            @JsonProperty("NUMBER_DELETED_ROWS") Long numberDeletedRows,
            @JsonProperty("DATA_SIZE") Long dataSize,
            @JsonProperty("VARIABLE_LENGTH_SIZE") Long variableLengthSize,
            @JsonProperty("VARIABLE_LENGTH_SEGMENTS") Long variableLengthSegments,
            @JsonProperty("COLUMN_STATS_SIZE") Long columnStatsSize,
            @JsonProperty("MAINTAINED_TEMPORARY_INDEX_SIZE") Long maintainedTemporaryIndexSize,
            @JsonProperty("NUMBER_DISTINCT_INDEXES") Long numberDistinctIndexes,
            @JsonProperty("OPEN_OPERATIONS") Long openOperations,
            @JsonProperty("CLOSE_OPERATIONS") Long closeOperations,
            @JsonProperty("INSERT_OPERATIONS") Long insertOperations,
            @JsonProperty("BLOCKED_INSERT_OPERATIONS") Long blockedInsertOperations,
            @JsonProperty("BLOCKED_INSERT_ROWS") Long blockedInsertRows,
            @JsonProperty("UPDATE_OPERATIONS") Long updateOperations,
            @JsonProperty("DELETE_OPERATIONS") Long deleteOperations,
            @JsonProperty("CLEAR_OPERATIONS") Long clearOperations,
            @JsonProperty("COPY_OPERATIONS") Long copyOperations,
            @JsonProperty("REORGANIZE_OPERATIONS") Long reorganizeOperations,
            @JsonProperty("INDEX_BUILDS") Long indexBuilds,
            @JsonProperty("LOGICAL_READS") Long logicalReads,
            @JsonProperty("PHYSICAL_READS") Long physicalReads,
            @JsonProperty("SEQUENTIAL_READS") Long sequentialReads,
            @JsonProperty("RANDOM_READS") Long randomReads,
            @JsonProperty("NEXT_IDENTITY_VALUE") String nextIdentityValue,
            @JsonProperty("KEEP_IN_MEMORY") String keepInMemory,
            @JsonProperty("MEDIA_PREFERENCE") String mediaPreference,
            @JsonProperty("VOLATILE") String volatileValue,
            @JsonProperty("PARTIAL_TRANSACTION") String partialTransaction,
            @JsonProperty("APPLY_STARTING_RECEIVER_LIBRARY") String applyStartingReceiverLibrary,
            @JsonProperty("APPLY_STARTING_RECEIVER") String applyStartingReceiver) implements ObjectRow {

        public static final int COLUMNS = 58;

        static SourceMemberStatistics read(RowReader row) throws SQLException {
            return new SourceMemberStatistics(
                    row.text(1),
                    row.text(2),
                    row.text(3),
                    row.text(4),
                    row.text(5),
                    row.text(6),
                    row.text(7),
                    row.text(8),
                    row.text(9),
                    row.text(10),
                    row.text(11),
                    row.text(12),
                    row.text(13),
                    row.number(14),
                    row.text(15),
                    row.text(16),
                    row.text(17),
                    row.number(18),
                    row.number(19),
                    row.number(20),
                    row.text(21),
                    row.text(22),
                    row.text(23),
                    row.text(24),
                    row.text(25),
                    row.number(26),
                    row.number(27),
                    row.number(28),
                    row.number(29),
                    row.number(30),
                    row.number(31),
                    row.number(32),
                    row.number(33),
                    row.number(34),
                    row.number(35),
                    row.number(36),
                    row.number(37),
                    row.number(38),
                    row.number(39),
                    row.number(40),
                    row.number(41),
                    row.number(42),
                    row.number(43),
                    row.number(44),
                    row.number(45),
                    row.number(46),
                    row.number(47),
                    row.number(48),
                    row.number(49),
                    row.number(50),
                    row.number(51),
                    row.text(52),
                    row.text(53),
                    row.text(54),
                    row.text(55),
                    row.text(56),
                    row.text(57),
                    row.text(58));
        }
    }

    /**
     * Serializa resultados de metadados em JSON indentado. Todos os campos
     * aparecem, inclusive os nulos, para que o formato seja sempre o mesmo.
     */
    public static final class MetadataRenderer {
        private final ObjectMapper mapper;

        public MetadataRenderer() {
            this(new ObjectMapper());
        }

        public MetadataRenderer(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
        }

        public String libraryInfo(String library, Optional<LibraryInfo> info) {
            if (info.isEmpty()) {
                return error("No data found for library for Library: " + library);
            }
            return write(info.get());
        }

        public String objects(String library, List<? extends ObjectRow> rows) {
            if (rows.isEmpty()) {
                return error("No Files Found in Library: " + library);
            }
            return write(rows);
        }

        public String error(String message) {
            ObjectNode node = mapper.createObjectNode();
            node.put("error", message);
            return write(node);
        }

        private String write(Object value) {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Falha ao serializar metadados: " + e.getOriginalMessage(), e);
            }
        }
    }

    /**
     * Falha de consulta de metadados (conexão ou SQL recusado pelo host).
     */
    public static final class MetadataQueryException extends IOException {
        private final String library;
        private final String sqlState;

        public MetadataQueryException(String library, SQLException cause) {
            super("Falha ao consultar metadados da biblioteca " + library + ": " + cause.getMessage(), cause);
            this.library = library;
            this.sqlState = cause.getSQLState();
        }

        public String library() { return library; }
        public String sqlState() { return sqlState; }
    }
}
