package com.example.ilibrary.command;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Monta o texto dos comandos CL enviados ao QCMDEXC.
 *
 * Todo argumento passa por validação antes da interpolação:
 * - nomes de objeto seguem o alfabeto de nomes de sistema do IBM i (máx. 10);
 * - o texto descritivo tem aspas simples duplicadas e não aceita caracteres de controle;
 * - caminhos do IFS aceitam apenas um alfabeto conservador (sem aspas, espaços ou metacaracteres do QSH).
 *
 * O formato de cada comando é fixo; nada aqui executa comandos.
 */
public final class ClCommands {

    /** Texto padrão do CRTSAVF quando nenhuma descrição é informada. */
    public static final String DEFAULT_DESCRIPTION = "A SaveFile from iLibrary";
    /** Limite do parâmetro TEXT dos comandos CRTxxx. */
    public static final int MAX_DESCRIPTION_LENGTH = 50;
    public static final String CURRENT_RELEASE = "*CURRENT";

    private static final Pattern SAFE_PATH = Pattern.compile("^/[A-Za-z0-9_./~+-]*$");
    private static final Pattern RELEASE = Pattern.compile("^(\\*CURRENT|\\*PRV|V\\d+R\\d+M\\d+)$");

    private ClCommands() {}

    /** {@code CRTSAVF FILE(LIB/NAME) TEXT('desc')} */
    public static String createSaveFile(ObjectName library, ObjectName saveFile, String description) {
        return "CRTSAVF FILE(" + qualified(library, saveFile) + ") TEXT('" + description(description) + "')";
    }

    /** {@code SAVLIB LIB(L) DEV(*SAVF) SAVF(T/S) TGTRLS(V)} */
    public static String saveLibrary(ObjectName library, ObjectName toLibrary, ObjectName saveFile, String targetRelease) {
        Objects.requireNonNull(library, "library");
        return "SAVLIB LIB(" + library + ") DEV(*SAVF) SAVF(" + qualified(toLibrary, saveFile)
                + ") TGTRLS(" + targetRelease(targetRelease) + ")";
    }

    /** {@code CPYTOSTMF FROMMBR('/QSYS.LIB/L.LIB/S.FILE') TOSTMF('path') STMFOPT(*REPLACE)} */
    public static String copyToStreamFile(ObjectName library, ObjectName saveFile, String streamFile) {
        return "CPYTOSTMF FROMMBR('" + qsysPath(library, saveFile) + "') TOSTMF('" + ifsPath(streamFile)
                + "') STMFOPT(*REPLACE)";
    }

    /** {@code QSH CMD('rm -r path')} */
    public static String removeStreamFile(String streamFile) {
        return "QSH CMD('rm -r " + ifsPath(streamFile) + "')";
    }

    /** {@code DLTF FILE(LIB/NAME)} */
    public static String deleteFile(ObjectName library, ObjectName file) {
        return "DLTF FILE(" + qualified(library, file) + ")";
    }

    /** Caminho do save file no sistema de arquivos QSYS.LIB. */
    public static String qsysPath(ObjectName library, ObjectName saveFile) {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(saveFile, "saveFile");
        return "/QSYS.LIB/" + library + ".LIB/" + saveFile + ".FILE";
    }

    /**
     * Normaliza a descrição: padrão quando vazia, aspas simples duplicadas,
     * rejeita caracteres de controle e textos acima de 50 posições.
     */
    public static String description(String description) {
        if (description == null || description.isBlank()) {
            return DEFAULT_DESCRIPTION;
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("A descrição excede " + MAX_DESCRIPTION_LENGTH + " caracteres: " + description.length());
        }
        for (int i = 0; i < description.length(); i++) {
            if (Character.isISOControl(description.charAt(i))) {
                throw new IllegalArgumentException("A descrição contém caracteres de controle.");
            }
        }
        return description.replace("'", "''");
    }

    /** TGTRLS aceito: *CURRENT (padrão), *PRV ou VxRyMz. */
    public static String targetRelease(String release) {
        if (release == null || release.isBlank()) {
            return CURRENT_RELEASE;
        }
        String normalized = release.trim().toUpperCase(Locale.ROOT);
        if (!RELEASE.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Release alvo inválido: " + release);
        }
        return normalized;
    }

    /** Caminho absoluto do IFS, restrito a um alfabeto seguro dentro de QSH/CL. */
    public static String ifsPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Um caminho remoto é obrigatório.");
        }
        if (!SAFE_PATH.matcher(path).matches() || path.contains("..")) {
            throw new IllegalArgumentException("Caminho remoto com caracteres não permitidos: " + path);
        }
        return path;
    }

    private static String qualified(ObjectName library, ObjectName object) {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(object, "object");
        return library + "/" + object;
    }

    /**
     * Nome de objeto do IBM i (biblioteca, arquivo). Sempre em maiúsculas.
     */
    public static final class ObjectName {

        public static final int MAX_LENGTH = 10;
        private static final Pattern SYSTEM_NAME = Pattern.compile("^[A-Za-z$#@][A-Za-z0-9$#@_.]*$");

        private final String value;

        private ObjectName(String value) {
            this.value = value;
        }

        /**
         * Valida e normaliza. {@code label} aparece na mensagem de erro.
         *
         * @throws IllegalArgumentException se vazio, maior que 10 ou fora do alfabeto
         */
        public static ObjectName of(String raw, String label) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Nome de " + label + " obrigatório.");
            }
            String trimmed = raw.trim();
            // só ASCII: toUpperCase muda o tamanho de alguns caracteres (ß vira SS)
            if (!SYSTEM_NAME.matcher(trimmed).matches()) {
                throw new IllegalArgumentException("Nome de " + label + " inválido: " + raw);
            }
            if (trimmed.length() > MAX_LENGTH) {
                throw new IllegalArgumentException("Nome de " + label + " excede " + MAX_LENGTH + " caracteres: " + trimmed);
            }
            return new ObjectName(trimmed.toUpperCase(Locale.ROOT));
        }

        public String value() { return value; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ObjectName)) return false;
            return value.equals(((ObjectName) o).value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return value; }
    }
}
