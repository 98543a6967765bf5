package com.reclink.mapred;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.reclink.Record;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.WritableUtils;

/**
 * Writable for a raw record.
 *
 * Input lines are JSON objects:
 * {"id":"r1","file":"f1","values":["ann","1970"]}
 *
 * Instances are reused across calls to {@link #parseFromJson(String)}.
 */
public class RecordWritable implements Writable {

  private static final Gson GSON = new Gson();

  private String id = "";
  private String fileId = "";
  private String[] values = new String[0];

  public String getId() {
    return id;
  }

  public String getFileId() {
    return fileId;
  }

  public String[] getValues() {
    return values;
  }

  public int numValues() {
    return values.length;
  }

  public void set(Record<String> record) {
    id = record.getId();
    fileId = record.getFileId();
    values = record.getValues().toArray(new String[0]);
  }

  public Record<String> toRecord() {
    return new Record<>(id, fileId, Arrays.asList(values));
  }

  @Override
  public void write(DataOutput out) throws IOException {
    WritableUtils.writeString(out, id);
    WritableUtils.writeString(out, fileId);
    WritableUtils.writeStringArray(out, values);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    id = WritableUtils.readString(in);
    fileId = WritableUtils.readString(in);
    values = WritableUtils.readStringArray(in);
  }

  /**
   * Parse from a JSON line.
   *
   * @param json The JSON string to parse
   * @return true if parsing succeeded, false otherwise
   */
  public boolean parseFromJson(String json) {
    JsonObject obj;
    try {
      obj = GSON.fromJson(json, JsonObject.class);
    } catch (JsonParseException | ClassCastException e) {
      return false;
    }
    if (obj == null) return false;

    String parsedId = asString(obj.get("id"));
    String parsedFile = asString(obj.get("file"));
    JsonElement rawValues = obj.get("values");
    if (parsedId == null || parsedFile == null || rawValues == null || !rawValues.isJsonArray()) {
      return false;
    }

    JsonArray array = rawValues.getAsJsonArray();
    String[] parsedValues = new String[array.size()];
    for (int i = 0; i < parsedValues.length; i++) {
      parsedValues[i] = asString(array.get(i));
      if (parsedValues[i] == null) return false;
    }

    id = parsedId;
    fileId = parsedFile;
    values = parsedValues;
    return true;
  }

  // Accepts strings and numbers, rejects null, objects and arrays
  private static String asString(JsonElement e) {
    if (e == null || !e.isJsonPrimitive()) return null;
    return e.getAsString();
  }

  @Override
  public String toString() {
    return "RecordWritable{id=" + id + ", fileId=" + fileId + ", values=" + Arrays.toString(values) + "}";
  }
}
