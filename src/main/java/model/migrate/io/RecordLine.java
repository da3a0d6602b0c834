package model.migrate.io;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import model.migrate.error.MalformedModelException;

/**
 * One TAB-separated input record. A single field holds the model JSON;
 * the other fields are carried through untouched.
 */
public final class RecordLine {
    /** Field index meaning "the last field of the line". */
    public static final int LAST_FIELD = -1;

    private final List<String> fields;
    private final int modelIndex;

    private RecordLine(List<String> fields, int modelIndex) {
        this.fields = fields;
        this.modelIndex = modelIndex;
    }

    public static RecordLine parse(String line, int modelField) {
        if (line == null) throw new IllegalArgumentException("line must not be null");
        List<String> fields = List.of(line.split("\t", -1));
        int index = modelField == LAST_FIELD ? fields.size() - 1 : modelField;
        if (index < 0 || index >= fields.size()) {
            throw new MalformedModelException("record has " + fields.size() + " field(s), no model field at index " + modelField);
        }
        return new RecordLine(fields, index);
    }

    public String model() { return fields.get(modelIndex); }

    public List<String> fields() { return fields; }

    /** Same record with the model field replaced. */
    public String withModel(String modelJson) {
        List<String> out = new ArrayList<>(fields);
        out.set(modelIndex, modelJson);
        return String.join("\t", out);
    }

    @Override
    public String toString() { return "RecordLine" + Arrays.toString(fields.toArray()) + " model=" + modelIndex; }
}
