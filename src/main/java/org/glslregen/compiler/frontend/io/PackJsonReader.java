package org.glslregen.compiler.frontend.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.glslregen.compiler.ir.BranchOperator;
import org.glslregen.compiler.ir.EvaluableRValue;
import org.glslregen.compiler.ir.FunctionDefinition;
import org.glslregen.compiler.ir.FunctionId;
import org.glslregen.compiler.ir.GlobalSymbol;
import org.glslregen.compiler.ir.GlobalSymbolId;
import org.glslregen.compiler.ir.Literal;
import org.glslregen.compiler.ir.LiteralRValue;
import org.glslregen.compiler.ir.LocalSymbol;
import org.glslregen.compiler.ir.LocalSymbolId;
import org.glslregen.compiler.ir.Pack;
import org.glslregen.compiler.ir.RValue;
import org.glslregen.compiler.ir.RValueId;
import org.glslregen.compiler.ir.RValueOperator;
import org.glslregen.compiler.ir.Statement;
import org.glslregen.compiler.ir.StatementBlockId;
import org.glslregen.compiler.ir.Type;
import org.glslregen.compiler.ir.TypeId;
import org.glslregen.compiler.ir.ValueId;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads a {@link Pack} from its JSON serialization.
 * <p>
 * The document is an object whose members mirror the pack's tables. Every table is an array of
 * entries carrying their original {@code id}, which is preserved:
 * <pre>{@code
 * {
 *   "types":           [ {"id": 1, "precision": "highp", "name": "vec4", "arraySizes": [2]},
 *                        {"id": 2, "name": "Light", "memberNames": ["color"], "memberTypes": [1]} ],
 *   "functionNames":   [ {"id": 1, "name": "main("} ],
 *   "globalSymbols":   [ {"id": 1, "name": "uColor"} ],
 *   "rValues": [
 *     {"id": 1, "op": "Add", "args": [ {"local": 1}, {"global": 1} ]},
 *     {"id": 2, "call": 1, "args": [ {"rvalue": 1} ]},
 *     {"id": 3, "literal": {"float": 0.5}}
 *   ],
 *   "statementBlocks": [ {"id": 1, "statements": [
 *     {"kind": "expression", "rvalue": 2},
 *     {"kind": "if", "condition": {"local": 1}, "then": 2, "else": 3},
 *     {"kind": "switch", "condition": {"local": 1}, "body": 4},
 *     {"kind": "branch", "op": "return", "operand": {"rvalue": 3}},
 *     {"kind": "loop", "condition": {"local": 1}, "body": 5, "testFirst": true, "terminal": 6}
 *   ]} ],
 *   "functionDefinitions": [ {"name": 1, "returnType": 1, "parameters": [1],
 *                             "localSymbols": [ {"id": 1, "type": 1, "name": "color"} ], "body": 1} ],
 *   "functionPrototypes":      [1],
 *   "functionDefinitionOrder": [1]
 * }
 * }</pre>
 * Literal kinds are {@code bool}, {@code int}, {@code uint}, {@code float} and {@code double}.
 * Operators and branch kinds accept either their display name ({@code AddAssign}, {@code return})
 * or their enum constant name. Absent tables are treated as empty.
 *
 * <p>Literal payloads must match their kind exactly: an {@code int} that has a fraction or does not
 * fit 32 bits is rejected rather than converted. Ids must be unique within each table.</p>
 *
 * <p>The reader checks structure only; dangling ids are left for the regenerator to report.</p>
 */
public final class PackJsonReader {

    private PackJsonReader() {
    }

    /**
     * Reads a pack from a UTF-8 file.
     *
     * @throws IOException         If the file cannot be read.
     * @throws PackFormatException If the content is not a valid pack document.
     */
    public static Pack read(Path file) throws IOException, PackFormatException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static Pack readString(String json) throws PackFormatException {
        return read(new StringReader(json));
    }

    public static Pack read(Reader reader) throws PackFormatException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new PackFormatException("Invalid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new PackFormatException("Pack document must be a JSON object");
        }
        try {
            return readPack(root.getAsJsonObject());
        } catch (IllegalArgumentException e) {
            // Raised by the IR constructors for invariant violations (negative ids, sentinel keys, ...)
            throw new PackFormatException(e.getMessage(), e);
        }
    }

    private static Pack readPack(JsonObject root) throws PackFormatException {
        Pack.Builder builder = Pack.builder();

        for (Entry entry : entries(root, "types")) {
            JsonObject o = entry.object();
            builder.putType(new TypeId(entry.id()), new Type(
                    optionalString(o, "precision", entry.path()),
                    string(o, "name", entry.path()),
                    intList(o, "arraySizes", entry.path()),
                    stringList(o, "memberNames", entry.path()),
                    typeIdList(o, "memberTypes", entry.path())));
        }
        for (Entry entry : entries(root, "functionNames")) {
            builder.putFunctionName(new FunctionId(entry.id()), string(entry.object(), "name", entry.path()));
        }
        for (Entry entry : entries(root, "globalSymbols")) {
            builder.putGlobalSymbol(new GlobalSymbolId(entry.id()),
                    new GlobalSymbol(string(entry.object(), "name", entry.path())));
        }
        for (Entry entry : entries(root, "rValues")) {
            builder.putRValue(new RValueId(entry.id()), readRValue(entry.object(), entry.path()));
        }
        for (Entry entry : entries(root, "statementBlocks")) {
            JsonArray statements = array(entry.object(), "statements", entry.path());
            List<Statement> block = new ArrayList<>(statements.size());
            for (int i = 0; i < statements.size(); i++) {
                String path = entry.path() + ".statements[" + i + "]";
                block.add(readStatement(asObject(statements.get(i), path), path));
            }
            builder.putStatementBlock(new StatementBlockId(entry.id()), block);
        }
        JsonArray definitions = optionalArray(root, "functionDefinitions", "$");
        Set<FunctionId> defined = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            String path = "functionDefinitions[" + i + "]";
            FunctionDefinition definition = readFunction(asObject(definitions.get(i), path), path);
            if (!defined.add(definition.name())) {
                throw new PackFormatException(path + ": duplicate definition of function " + definition.name().id());
            }
            builder.putFunctionDefinition(definition);
        }
        for (int id : intList(root, "functionPrototypes", "$")) {
            builder.addPrototype(new FunctionId(id));
        }
        for (int id : intList(root, "functionDefinitionOrder", "$")) {
            builder.addToDefinitionOrder(new FunctionId(id));
        }
        return builder.build();
    }

    private static RValue readRValue(JsonObject o, String path) throws PackFormatException {
        if (o.has("literal")) {
            return new LiteralRValue(readLiteral(asObject(o.get("literal"), path + ".literal"), path + ".literal"));
        }
        List<ValueId> args = new ArrayList<>();
        JsonArray argArray = optionalArray(o, "args", path);
        for (int i = 0; i < argArray.size(); i++) {
            String argPath = path + ".args[" + i + "]";
            args.add(readValue(asObject(argArray.get(i), argPath), argPath));
        }
        if (o.has("call")) {
            return new EvaluableRValue(new FunctionId(integer(o, "call", path)), args);
        }
        String op = string(o, "op", path);
        try {
            return new EvaluableRValue(RValueOperator.fromName(op), args);
        } catch (IllegalArgumentException e) {
            throw new PackFormatException(path + ": " + e.getMessage(), e);
        }
    }

    private static Literal readLiteral(JsonObject o, String path) throws PackFormatException {
        if (o.size() != 1) {
            throw new PackFormatException(path + ": literal must have exactly one kind");
        }
        Map.Entry<String, JsonElement> member = o.entrySet().iterator().next();
        String kind = member.getKey();
        String valuePath = path + "." + kind;
        JsonPrimitive value = asPrimitive(member.getValue(), valuePath);
        if (kind.equals("bool")) {
            if (!value.isBoolean()) {
                throw new PackFormatException(valuePath + ": expected a boolean");
            }
            return new Literal.BoolLiteral(value.getAsBoolean());
        }
        if (!value.isNumber()) {
            throw new PackFormatException(valuePath + ": expected a number");
        }
        // Parsed from the literal text so fractions and out-of-range values are rejected, not truncated
        String text = value.getAsString();
        try {
            switch (kind) {
                case "int":
                    return new Literal.IntLiteral(Integer.parseInt(text));
                case "uint":
                    return new Literal.UintLiteral(Long.parseLong(text));
                case "float":
                    return new Literal.FloatLiteral(Float.parseFloat(text));
                case "double":
                    return new Literal.DoubleLiteral(Double.parseDouble(text));
                default:
                    throw new PackFormatException(path + ": unknown literal kind '" + kind + "'");
            }
        } catch (NumberFormatException e) {
            throw new PackFormatException(valuePath + ": malformed " + kind + " literal " + text, e);
        } catch (IllegalArgumentException e) {
            throw new PackFormatException(valuePath + ": " + e.getMessage(), e);
        }
    }

    private static ValueId readValue(JsonObject o, String path) throws PackFormatException {
        if (o.has("rvalue")) {
            return new RValueId(integer(o, "rvalue", path));
        } else if (o.has("global")) {
            return new GlobalSymbolId(integer(o, "global", path));
        } else if (o.has("local")) {
            return new LocalSymbolId(integer(o, "local", path));
        }
        throw new PackFormatException(path + ": value must be one of rvalue, global or local");
    }

    private static Statement readStatement(JsonObject o, String path) throws PackFormatException {
        String kind = string(o, "kind", path);
        switch (kind) {
            case "expression":
                return new Statement.ExpressionStatement(new RValueId(integer(o, "rvalue", path)));
            case "if":
                return new Statement.IfStatement(
                        readValue(asObject(member(o, "condition", path), path + ".condition"), path + ".condition"),
                        new StatementBlockId(integer(o, "then", path)),
                        o.has("else")
                                ? Optional.of(new StatementBlockId(integer(o, "else", path)))
                                : Optional.empty());
            case "switch":
                return new Statement.SwitchStatement(
                        readValue(asObject(member(o, "condition", path), path + ".condition"), path + ".condition"),
                        new StatementBlockId(integer(o, "body", path)));
            case "branch":
                BranchOperator op;
                try {
                    op = BranchOperator.fromName(string(o, "op", path));
                } catch (IllegalArgumentException e) {
                    throw new PackFormatException(path + ": " + e.getMessage(), e);
                }
                Optional<ValueId> operand = o.has("operand")
                        ? Optional.of(readValue(asObject(o.get("operand"), path + ".operand"), path + ".operand"))
                        : Optional.empty();
                return new Statement.BranchStatement(op, operand);
            case "loop":
                return new Statement.LoopStatement(
                        readValue(asObject(member(o, "condition", path), path + ".condition"), path + ".condition"),
                        new StatementBlockId(integer(o, "body", path)),
                        !o.has("testFirst") || bool(o, "testFirst", path),
                        o.has("terminal")
                                ? Optional.of(new RValueId(integer(o, "terminal", path)))
                                : Optional.empty());
            default:
                throw new PackFormatException(path + ": unknown statement kind '" + kind + "'");
        }
    }

    private static FunctionDefinition readFunction(JsonObject o, String path) throws PackFormatException {
        Map<LocalSymbolId, LocalSymbol> locals = new TreeMap<>();
        for (Entry entry : entries(o, "localSymbols", path)) {
            locals.put(new LocalSymbolId(entry.id()), new LocalSymbol(
                    new TypeId(integer(entry.object(), "type", entry.path())),
                    string(entry.object(), "name", entry.path())));
        }
        List<LocalSymbolId> parameters = new ArrayList<>();
        for (int id : intList(o, "parameters", path)) {
            parameters.add(new LocalSymbolId(id));
        }
        return new FunctionDefinition(
                new TypeId(integer(o, "returnType", path)),
                new FunctionId(integer(o, "name", path)),
                parameters,
                locals,
                new StatementBlockId(integer(o, "body", path)));
    }

    // --- Structural helpers -------------------------------------------------

    private record Entry(int id, JsonObject object, String path) {}

    private static List<Entry> entries(JsonObject parent, String table) throws PackFormatException {
        return entries(parent, table, null);
    }

    private static List<Entry> entries(JsonObject parent, String table, String parentPath) throws PackFormatException {
        String tablePath = parentPath == null ? table : parentPath + "." + table;
        JsonArray array = optionalArray(parent, table, parentPath == null ? "$" : parentPath);
        List<Entry> entries = new ArrayList<>(array.size());
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            String path = tablePath + "[" + i + "]";
            JsonObject o = asObject(array.get(i), path);
            int id = integer(o, "id", path);
            if (!seen.add(id)) {
                throw new PackFormatException(path + ": duplicate id " + id);
            }
            entries.add(new Entry(id, o, path));
        }
        return entries;
    }

    private static JsonElement member(JsonObject o, String name, String path) throws PackFormatException {
        JsonElement e = o.get(name);
        if (e == null || e.isJsonNull()) {
            throw new PackFormatException(path + ": missing '" + name + "'");
        }
        return e;
    }

    private static JsonObject asObject(JsonElement e, String path) throws PackFormatException {
        if (!e.isJsonObject()) {
            throw new PackFormatException(path + ": expected an object");
        }
        return e.getAsJsonObject();
    }

    private static JsonPrimitive asPrimitive(JsonElement e, String path) throws PackFormatException {
        if (!e.isJsonPrimitive()) {
            throw new PackFormatException(path + ": expected a scalar");
        }
        return e.getAsJsonPrimitive();
    }

    private static JsonArray array(JsonObject o, String name, String path) throws PackFormatException {
        JsonElement e = member(o, name, path);
        if (!e.isJsonArray()) {
            throw new PackFormatException(path + "." + name + ": expected an array");
        }
        return e.getAsJsonArray();
    }

    private static JsonArray optionalArray(JsonObject o, String name, String path) throws PackFormatException {
        return o.has(name) ? array(o, name, path) : new JsonArray();
    }

    private static String string(JsonObject o, String name, String path) throws PackFormatException {
        JsonPrimitive p = asPrimitive(member(o, name, path), path + "." + name);
        if (!p.isString()) {
            throw new PackFormatException(path + "." + name + ": expected a string");
        }
        return p.getAsString();
    }

    private static String optionalString(JsonObject o, String name, String path) throws PackFormatException {
        return o.has(name) && !o.get(name).isJsonNull() ? string(o, name, path) : "";
    }

    private static int integer(JsonObject o, String name, String path) throws PackFormatException {
        return asInt(member(o, name, path), path + "." + name);
    }

    private static boolean bool(JsonObject o, String name, String path) throws PackFormatException {
        JsonPrimitive p = asPrimitive(member(o, name, path), path + "." + name);
        if (!p.isBoolean()) {
            throw new PackFormatException(path + "." + name + ": expected a boolean");
        }
        return p.getAsBoolean();
    }

    private static int asInt(JsonElement e, String path) throws PackFormatException {
        JsonPrimitive p = asPrimitive(e, path);
        if (!p.isNumber()) {
            throw new PackFormatException(path + ": expected an integer");
        }
        try {
            return Integer.parseInt(p.getAsString());
        } catch (NumberFormatException ex) {
            throw new PackFormatException(path + ": expected an integer, got " + p.getAsString(), ex);
        }
    }

    private static List<Integer> intList(JsonObject o, String name, String path) throws PackFormatException {
        JsonArray array = optionalArray(o, name, path);
        List<Integer> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(asInt(array.get(i), path + "." + name + "[" + i + "]"));
        }
        return values;
    }

    private static List<TypeId> typeIdList(JsonObject o, String name, String path) throws PackFormatException {
        List<TypeId> values = new ArrayList<>();
        for (int id : intList(o, name, path)) {
            values.add(new TypeId(id));
        }
        return values;
    }

    private static List<String> stringList(JsonObject o, String name, String path) throws PackFormatException {
        JsonArray array = optionalArray(o, name, path);
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonPrimitive p = asPrimitive(array.get(i), path + "." + name + "[" + i + "]");
            values.add(p.getAsString());
        }
        return values;
    }
}
