package org.termconf.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.termconf.language.LoadResult;
import org.termconf.language.diagnostics.ConfigError;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.parser.ast.AddViewCommand;
import org.termconf.language.parser.ast.ConfigCommand;
import org.termconf.language.parser.ast.ConfigCommandVisitor;
import org.termconf.language.parser.ast.MapCommand;
import org.termconf.language.parser.ast.NewTabCommand;
import org.termconf.language.parser.ast.QuitCommand;
import org.termconf.language.parser.ast.RemoveTabCommand;
import org.termconf.language.parser.ast.SetCommand;
import org.termconf.language.parser.ast.SplitViewCommand;
import org.termconf.language.parser.ast.ThemeCommand;
import org.termconf.language.parser.ast.UnmapCommand;

import java.util.List;

/**
 * Converts parsed commands and errors into JSON.
 */
public final class CommandJsonWriter implements ConfigCommandVisitor<JsonObject> {

    private static final CommandJsonWriter INSTANCE = new CommandJsonWriter();
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private CommandJsonWriter() {}

    /**
     * Renders everything read from a source as a pretty printed JSON document.
     * @param result The load result.
     * @return The JSON text.
     */
    public static String toJson(LoadResult result) {
        JsonObject root = new JsonObject();
        root.addProperty("source", result.sourceLabel());

        JsonArray commands = new JsonArray();
        result.commands().forEach(command -> commands.add(toJsonObject(command)));
        root.add("commands", commands);

        JsonArray errors = new JsonArray();
        for (ConfigError error : result.errors()) {
            JsonObject json = new JsonObject();
            json.addProperty("code", error.code().name());
            json.addProperty("line", error.line());
            json.addProperty("column", error.column());
            json.addProperty("message", error.message());
            errors.add(json);
        }
        root.add("errors", errors);

        return GSON.toJson(root);
    }

    /**
     * @param command The command.
     * @return A JSON object naming the command and holding the text of each of its fields.
     */
    public static JsonObject toJsonObject(ConfigCommand command) {
        return command.accept(INSTANCE);
    }

    @Override
    public JsonObject visitSet(SetCommand command) {
        JsonObject json = command("set");
        put(json, "variable", command.variable());
        put(json, "value", command.value());
        return json;
    }

    @Override
    public JsonObject visitTheme(ThemeCommand command) {
        JsonObject json = command("theme");
        put(json, "name", command.name());
        put(json, "component", command.component());
        put(json, "bgcolor", command.bgcolor());
        put(json, "fgcolor", command.fgcolor());
        return json;
    }

    @Override
    public JsonObject visitMap(MapCommand command) {
        JsonObject json = command("map");
        put(json, "view", command.view());
        put(json, "from", command.from());
        put(json, "to", command.to());
        return json;
    }

    @Override
    public JsonObject visitUnmap(UnmapCommand command) {
        JsonObject json = command("unmap");
        put(json, "view", command.view());
        put(json, "from", command.from());
        return json;
    }

    @Override
    public JsonObject visitQuit(QuitCommand command) {
        return command("quit");
    }

    @Override
    public JsonObject visitNewTab(NewTabCommand command) {
        JsonObject json = command("addtab");
        put(json, "tabName", command.tabName());
        return json;
    }

    @Override
    public JsonObject visitRemoveTab(RemoveTabCommand command) {
        return command("rmtab");
    }

    @Override
    public JsonObject visitAddView(AddViewCommand command) {
        JsonObject json = command("addview");
        put(json, "view", command.view());
        json.add("args", texts(command.args()));
        return json;
    }

    @Override
    public JsonObject visitSplitView(SplitViewCommand command) {
        JsonObject json = command("splitview");
        json.addProperty("orientation", command.orientation().name());
        put(json, "view", command.view());
        json.add("args", texts(command.args()));
        return json;
    }

    private static JsonObject command(String name) {
        JsonObject json = new JsonObject();
        json.addProperty("command", name);
        return json;
    }

    // Unset fields are left out.
    private static void put(JsonObject json, String field, ConfigToken token) {
        if (token != null) {
            json.addProperty(field, token.text());
        }
    }

    private static JsonArray texts(List<ConfigToken> tokens) {
        JsonArray array = new JsonArray();
        tokens.forEach(token -> array.add(token.text()));
        return array;
    }
}
