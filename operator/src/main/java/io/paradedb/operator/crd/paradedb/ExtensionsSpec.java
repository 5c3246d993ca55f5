package io.paradedb.operator.crd.paradedb;

import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;

@NullMarked
@Getter
@Setter
public class ExtensionsSpec {
    private boolean pgSearch = true;

    private boolean pgAnalytics = true;

    private boolean pgVector = false;

    private List<String> additional = new ArrayList<>();
}
