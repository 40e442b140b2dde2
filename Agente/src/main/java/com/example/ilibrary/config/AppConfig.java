package com.example.ilibrary.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AppConfig
 * ----------
 * Carrega, valida e expõe as configurações do agente de backup do IBM i.
 *
 * PRINCÍPIOS:
 * - Falhar cedo (validar assim que possível).
 * - Chaves centralizadas em constantes.
 * - Precedência previsível: System properties > variáveis de ambiente > .env.
 * - Getters tipados com limites.
 * - Sem vazamento de segredos em logs (toString() sanitizado).
 *
 * NOTAS:
 * - As chaves DB_* seguem o .env usado pelos scripts de operação existentes.
 * - A porta SSH padrão é 2222 (e não 22): é a porta do servidor SFTP do host.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Nome/IP do sistema IBM i (usado tanto pelo JDBC quanto pelo SFTP). */
    public static final String DB_SYSTEM = "DB_SYSTEM";
    /** Perfil de usuário do IBM i. */
    public static final String DB_USER = "DB_USER";
    /** Senha do perfil. NÃO logar. */
    public static final String DB_PASSWORD = "DB_PASSWORD";
    /** URL JDBC completa; sobrescreve a URL montada a partir de DB_SYSTEM. */
    public static final String DB_JDBC_URL = "DB_JDBC_URL";
    /** Auto-commit da conexão de comandos. Padrão true. */
    public static final String DB_AUTOCOMMIT = "DB_AUTOCOMMIT";
    /** Timeout (s) de login do DriverManager. Padrão 30. */
    public static final String DB_LOGIN_TIMEOUT_SECONDS = "DB_LOGIN_TIMEOUT_SECONDS";

    /** Porta do servidor SSH/SFTP. Padrão 2222. */
    public static final String SSH_PORT = "SSH_PORT";
    /** Timeout (ms) para conectar sessão e canal SFTP. Padrão 30000. */
    public static final String SSH_CONNECT_TIMEOUT_MS = "SSH_CONNECT_TIMEOUT_MS";
    /** Arquivo known_hosts; quando definido, a verificação de host key é ligada. */
    public static final String SSH_KNOWN_HOSTS = "SSH_KNOWN_HOSTS";
    /** Força StrictHostKeyChecking mesmo sem known_hosts explícito. */
    public static final String SSH_STRICT_HOST_KEY_CHECKING = "SSH_STRICT_HOST_KEY_CHECKING";

    /** Diretório padrão no IFS para o stream file temporário. */
    public static final String SAVF_REMOTE_DIR = "SAVF_REMOTE_DIR";
    /** Diretório local padrão para o download do save file. */
    public static final String SAVF_LOCAL_DIR = "SAVF_LOCAL_DIR";
    /** Release alvo do SAVLIB (TGTRLS). Padrão *CURRENT. */
    public static final String SAVF_TARGET_RELEASE = "SAVF_TARGET_RELEASE";

    public static final int DEFAULT_SSH_PORT = 2222;
    public static final String DEFAULT_TARGET_RELEASE = "*CURRENT";

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados (System properties > ENV > .env). */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes, com a seguinte precedência:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (System.getenv)
     * 3) Arquivo .env (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        System.getenv().forEach(map::put);

        // .env preenche apenas ausentes
        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /**
     * Busca valor obrigatório; lança IllegalStateException se ausente.
     */
    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS (COM VALIDAÇÃO) =======

    /** Host do IBM i, sem esquema e sem espaços. */
    public String host() {
        String raw = require(DB_SYSTEM).trim();
        if (raw.contains("://") || raw.contains(" ")) {
            throw new IllegalStateException("DB_SYSTEM deve conter apenas o nome ou IP do host: " + raw);
        }
        return raw;
    }

    public String user() {
        return require(DB_USER);
    }

    /** Senha do perfil (NÃO logar). */
    public String password() {
        return require(DB_PASSWORD);
    }

    /**
     * URL JDBC do Toolbox. Usa naming=system para que LIB/OBJ funcione
     * como no CL e errors=full para mensagens completas do host.
     */
    public String jdbcUrl() {
        return find(DB_JDBC_URL)
                .orElseGet(() -> "jdbc:as400://" + host() + ";naming=system;errors=full");
    }

    public boolean autoCommit() {
        return bool(DB_AUTOCOMMIT, true);
    }

    public int loginTimeoutSeconds() {
        return intConfig(DB_LOGIN_TIMEOUT_SECONDS, 30, 1, 600);
    }

    /** Porta SFTP em [1, 65535]; padrão 2222. */
    public int sshPort() {
        return intConfig(SSH_PORT, DEFAULT_SSH_PORT, 1, 65535);
    }

    public int sshConnectTimeoutMillis() {
        return intConfig(SSH_CONNECT_TIMEOUT_MS, 30_000, 1_000, 600_000);
    }

    public Optional<String> sshKnownHosts() {
        return find(SSH_KNOWN_HOSTS);
    }

    /**
     * Verificação de host key: ligada quando há known_hosts ou quando forçada.
     * Desligada por padrão, como nos scripts que adicionavam chaves desconhecidas.
     */
    public boolean strictHostKeyChecking() {
        return sshKnownHosts().isPresent() || bool(SSH_STRICT_HOST_KEY_CHECKING, false);
    }

    public Optional<String> remoteDirectory() {
        return find(SAVF_REMOTE_DIR);
    }

    public Optional<String> localDirectory() {
        return find(SAVF_LOCAL_DIR);
    }

    public String targetRelease() {
        return getOrDefault(SAVF_TARGET_RELEASE, DEFAULT_TARGET_RELEASE).trim().toUpperCase(Locale.ROOT);
    }

    // ======= HELPERS TIPADOS =======

    /**
     * Flag booleana tolerante: "true/1/yes" (case-insensitive) → true; senão, false.
     */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    /**
     * Representação segura para logs: nunca inclui senha, apenas "set/unset".
     */
    @Override
    public String toString() {
        String system = safe(() -> find(DB_SYSTEM).orElse("unset"));
        String user = safe(() -> find(DB_USER).orElse("unset"));
        return "AppConfig{" +
                "system=" + system +
                ", user=" + user +
                ", password=" + (find(DB_PASSWORD).isPresent() ? "set" : "unset") +
                ", autoCommit=" + autoCommit() +
                ", sshPort=" + sshPort() +
                ", strictHostKey=" + strictHostKeyChecking() +
                ", remoteDir=" + remoteDirectory().orElse("unset") +
                ", localDir=" + localDirectory().orElse("unset") +
                ", targetRelease=" + targetRelease() +
                "}";
    }

    /** Helper para não explodir toString() caso getters lancem. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
