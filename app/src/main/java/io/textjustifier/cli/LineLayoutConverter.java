package io.textjustifier.cli;

import io.textjustifier.format.LineLayout;
import picocli.CommandLine;

public class LineLayoutConverter implements CommandLine.ITypeConverter<LineLayout> {

    @Override
    public LineLayout convert(String value) {
        return LineLayout.from(value);
    }
}
