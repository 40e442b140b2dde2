package com.example.ilibrary.savefile;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.ilibrary.command.ClCommands;
import com.example.ilibrary.command.ClCommands.ObjectName;
import com.example.ilibrary.command.RemoteCommand.CommandChannel;
import com.example.ilibrary.command.RemoteCommand.CommandException;

/**
 * Operações sobre save files (*SAVF) no host.
 */
public final class SaveFiles {

    private SaveFiles() {}

    /**
     * Cria e remove save files. Cada operação é um único comando seguido de
     * commit; em falha, rollback e a exceção do host sobe para quem chama.
     */
    public static final class SaveFileManager {
        private static final Logger log = LoggerFactory.getLogger(SaveFileManager.class);

        private final CommandChannel commands;

        public SaveFileManager(CommandChannel commands) {
            this.commands = Objects.requireNonNull(commands, "commands");
        }

        /**
         * CRTSAVF na biblioteca indicada. Sem descrição, usa o texto padrão.
         */
        public void create(String saveFileName, String library, String description) throws CommandException {
            create(ObjectName.of(saveFileName, "save file"), ObjectName.of(library, "biblioteca"), description);
        }

        public void create(ObjectName saveFile, ObjectName library, String description) throws CommandException {
            Objects.requireNonNull(saveFile, "saveFile");
            Objects.requireNonNull(library, "library");
            run(ClCommands.createSaveFile(library, saveFile, description));
            log.info("Save file {}/{} criado.", library, saveFile);
        }

        /**
         * DLTF do save file. Um save file inexistente resulta em CommandException
         * (o host recusa o comando), nunca em sucesso silencioso.
         */
        public void remove(String library, String saveFileName) throws CommandException {
            remove(ObjectName.of(library, "biblioteca"), ObjectName.of(saveFileName, "save file"));
        }

        public void remove(ObjectName library, ObjectName saveFile) throws CommandException {
            Objects.requireNonNull(library, "library");
            Objects.requireNonNull(saveFile, "saveFile");
            run(ClCommands.deleteFile(library, saveFile));
            log.info("Save file {}/{} removido.", library, saveFile);
        }

        private void run(String command) throws CommandException {
            try {
                commands.execute(command);
                commands.commit();
            } catch (CommandException e) {
                log.error("Comando recusado pelo host: {}", e.getMessage());
                commands.rollback();
                throw e;
            }
        }
    }
}
