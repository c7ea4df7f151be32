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
 * Ordered list of table settings. Tables are processed in the listed order and independently of
 * each other.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TablesConfiguration {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<TableConfiguration> tables = new ArrayList<>();
}
