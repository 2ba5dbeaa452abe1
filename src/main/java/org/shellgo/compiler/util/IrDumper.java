package org.shellgo.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import org.shellgo.compiler.ir.IrProgram;
import org.shellgo.compiler.ir.IrStatement;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes IR programs as pretty-printed JSON for inspection. Every statement
 * object starts with its {@code kind}.
 */
public final class IrDumper {

	private static final Gson GSON = new GsonBuilder()
			.setPrettyPrinting()
			.disableHtmlEscaping()
			.serializeNulls()
			.registerTypeAdapterFactory(new StatementKindFactory())
			.create();

	private IrDumper() {}

	/**
	 * @param program The program.
	 * @return The program as JSON.
	 */
	public static String toJson(IrProgram program) {
		return GSON.toJson(program);
	}

	/**
	 * Writes the JSON form of a program to a file.
	 * @param program The program.
	 * @param file The target file; parent directories are created.
	 * @throws IOException if the file cannot be written.
	 */
	public static void dump(IrProgram program, Path file) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(file, toJson(program) + "\n", StandardCharsets.UTF_8);
	}

	private static final class StatementKindFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			Class<? super T> raw = type.getRawType();
			if (!IrStatement.class.isAssignableFrom(raw) || raw.isInterface()) {
				return null;
			}
			TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
			TypeAdapter<JsonElement> elements = gson.getAdapter(JsonElement.class);
			return new TypeAdapter<>() {
				@Override
				public void write(JsonWriter out, T value) throws IOException {
					if (value == null) {
						out.nullValue();
						return;
					}
					JsonObject fields = delegate.toJsonTree(value).getAsJsonObject();
					JsonObject tagged = new JsonObject();
					tagged.addProperty("kind", ((IrStatement) value).kind().name());
					for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
						tagged.add(entry.getKey(), entry.getValue());
					}
					elements.write(out, tagged);
				}

				@Override
				public T read(JsonReader in) {
					throw new UnsupportedOperationException("IR dumps are write-only");
				}
			};
		}
	}
}
