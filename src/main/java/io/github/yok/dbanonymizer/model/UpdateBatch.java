package io.github.yok.dbanonymizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * The update commands generated for one page; executed once as a unit.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class UpdateBatch {

    private final String tableName;
    private final int pageIndex;
    private final List<UpdateCommand> commands;

    /**
     * Creates a batch.
     *
     * @param tableName physical table name (for logging)
     * @param pageIndex zero-based page index
     * @param commands row commands of the page
     */
    public UpdateBatch(String tableName, int pageIndex, List<UpdateCommand> commands) {
        this.tableName = tableName;
        this.pageIndex = pageIndex;
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
    }

    /**
     * Returns whether the page produced no command at all.
     *
     * @return true when there is nothing to execute
     */
    public boolean isEmpty() {
        return commands.isEmpty();
    }

    /**
     * Returns the number of row commands.
     *
     * @return command count
     */
    public int size() {
        return commands.size();
    }
}
