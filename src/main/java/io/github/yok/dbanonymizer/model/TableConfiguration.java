package io.github.yok.dbanonymizer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anonymization settings of one table as written in the tables configuration file.
 *
 * <p>
 * Column names are matched against the table's physical columns ignoring case. Duplicates inside
 * one list are ignored; a column listed in both lists is a configuration error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableConfiguration {

    // Table name (required)
    private String tableName;

    // Columns whose values are replaced with random strings of the same length
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> anonymizeColumns = new ArrayList<>();

    // Columns whose values are set to NULL
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> nullColumns = new ArrayList<>();
}
