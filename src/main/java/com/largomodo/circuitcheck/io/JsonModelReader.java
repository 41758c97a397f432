package com.largomodo.circuitcheck.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.architecture.GateImplementationInfo;
import com.largomodo.circuitcheck.architecture.GateInfo;
import com.largomodo.circuitcheck.circuit.Circuit;
import com.largomodo.circuitcheck.circuit.Instruction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reads the JSON documents accepted by the command line tool.
 * <p>
 * Field names follow the server's architecture and circuit payloads (snake_case). Override
 * loci in {@code override_default_implementation} are written as comma-joined component names,
 * e.g. {@code "QB1,QB2"}.
 */
public class JsonModelReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public DynamicArchitecture readArchitecture(Path file) throws IOException {
        return parseArchitecture(readTree(file), file.toString());
    }

    public List<Circuit> readCircuits(Path file) throws IOException {
        return parseCircuits(readTree(file), file.toString());
    }

    public Map<String, String> readQubitMapping(Path file) throws IOException {
        return parseQubitMapping(readTree(file), file.toString());
    }

    public DynamicArchitecture parseArchitecture(String json) {
        return parseArchitecture(readTree(json), "<architecture>");
    }

    public List<Circuit> parseCircuits(String json) {
        return parseCircuits(readTree(json), "<circuits>");
    }

    public Map<String, String> parseQubitMapping(String json) {
        return parseQubitMapping(readTree(json), "<qubit mapping>");
    }

    private DynamicArchitecture parseArchitecture(JsonNode root, String source) {
        requireObject(root, source);
        String idText = requiredText(root, "calibration_set_id", source);
        UUID calibrationSetId;
        try {
            calibrationSetId = UUID.fromString(idText);
        } catch (IllegalArgumentException e) {
            throw new ModelFormatException(source + ": calibration_set_id is not a UUID: " + idText, e);
        }

        List<String> qubits = stringList(root.get("qubits"), source + ".qubits");
        JsonNode resonatorNode = root.get("computational_resonators");
        List<String> resonators = resonatorNode == null || resonatorNode.isNull()
                ? List.of()
                : stringList(resonatorNode, source + ".computational_resonators");

        Map<String, GateInfo> gates = new LinkedHashMap<>();
        JsonNode gatesNode = root.get("gates");
        if (gatesNode != null && !gatesNode.isNull()) {
            requireObject(gatesNode, source + ".gates");
            Iterator<Map.Entry<String, JsonNode>> it = gatesNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> gate = it.next();
                gates.put(gate.getKey(), parseGate(gate.getValue(), source + ".gates." + gate.getKey()));
            }
        }

        try {
            return new DynamicArchitecture(calibrationSetId, qubits, resonators, gates);
        } catch (IllegalArgumentException e) {
            throw new ModelFormatException(source + ": " + e.getMessage(), e);
        }
    }

    private GateInfo parseGate(JsonNode node, String source) {
        requireObject(node, source);
        JsonNode implsNode = node.get("implementations");
        requireObject(implsNode, source + ".implementations");

        Map<String, GateImplementationInfo> implementations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = implsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> impl = it.next();
            String implSource = source + ".implementations." + impl.getKey();
            requireObject(impl.getValue(), implSource);
            JsonNode lociNode = impl.getValue().get("loci");
            if (lociNode == null || !lociNode.isArray()) {
                throw new ModelFormatException(implSource + ": 'loci' must be an array");
            }
            List<List<String>> loci = new ArrayList<>();
            for (int i = 0; i < lociNode.size(); i++) {
                loci.add(stringList(lociNode.get(i), implSource + ".loci[" + i + "]"));
            }
            try {
                implementations.put(impl.getKey(), new GateImplementationInfo(loci));
            } catch (IllegalArgumentException e) {
                throw new ModelFormatException(implSource + ": " + e.getMessage(), e);
            }
        }

        String defaultImpl = requiredText(node, "default_implementation", source);

        Map<List<String>, String> overrides = new LinkedHashMap<>();
        JsonNode overrideNode = node.get("override_default_implementation");
        if (overrideNode != null && !overrideNode.isNull()) {
            requireObject(overrideNode, source + ".override_default_implementation");
            Iterator<Map.Entry<String, JsonNode>> ov = overrideNode.fields();
            while (ov.hasNext()) {
                Map.Entry<String, JsonNode> entry = ov.next();
                List<String> locus = Arrays.stream(entry.getKey().split(","))
                        .map(String::trim)
                        .toList();
                overrides.put(locus, entry.getValue().asText());
            }
        }

        try {
            return new GateInfo(implementations, defaultImpl, overrides);
        } catch (IllegalArgumentException e) {
            throw new ModelFormatException(source + ": " + e.getMessage(), e);
        }
    }

    private List<Circuit> parseCircuits(JsonNode root, String source) {
        if (root == null || !root.isArray()) {
            throw new ModelFormatException(source + ": expected an array of circuits");
        }
        List<Circuit> circuits = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode circuitNode = root.get(i);
            String circuitSource = source + "[" + i + "]";
            requireObject(circuitNode, circuitSource);
            String name = requiredText(circuitNode, "name", circuitSource);

            JsonNode instructionsNode = circuitNode.get("instructions");
            if (instructionsNode == null || !instructionsNode.isArray()) {
                throw new ModelFormatException(circuitSource + ": 'instructions' must be an array");
            }
            List<Instruction> instructions = new ArrayList<>();
            for (int j = 0; j < instructionsNode.size(); j++) {
                instructions.add(parseInstruction(instructionsNode.get(j), circuitSource + ".instructions[" + j + "]"));
            }
            circuits.add(new Circuit(name, instructions));
        }
        return circuits;
    }

    private Instruction parseInstruction(JsonNode node, String source) {
        requireObject(node, source);
        String name = requiredText(node, "name", source);
        List<String> qubits = stringList(node.get("qubits"), source + ".qubits");

        Map<String, Object> args = new LinkedHashMap<>();
        JsonNode argsNode = node.get("args");
        if (argsNode != null && !argsNode.isNull()) {
            requireObject(argsNode, source + ".args");
            Iterator<Map.Entry<String, JsonNode>> it = argsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> arg = it.next();
                args.put(arg.getKey(), toValue(arg.getValue()));
            }
        }

        JsonNode implNode = node.get("implementation");
        String implementation = implNode == null || implNode.isNull() ? null : implNode.asText();
        try {
            return new Instruction(name, qubits, args, implementation);
        } catch (IllegalArgumentException e) {
            throw new ModelFormatException(source + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> parseQubitMapping(JsonNode root, String source) {
        requireObject(root, source);
        Map<String, String> mapping = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isTextual()) {
                throw new ModelFormatException(source + ": physical qubit for '" + entry.getKey() + "' must be a string");
            }
            mapping.put(entry.getKey(), entry.getValue().asText());
        }
        return mapping;
    }

    private Object toValue(JsonNode node) {
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, Object.class);
    }

    private JsonNode readTree(Path file) throws IOException {
        try {
            return mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new ModelFormatException(file + ": invalid JSON - " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelFormatException("Invalid JSON - " + e.getOriginalMessage(), e);
        }
    }

    private static void requireObject(JsonNode node, String source) {
        if (node == null || !node.isObject()) {
            throw new ModelFormatException(source + ": expected a JSON object");
        }
    }

    private static String requiredText(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ModelFormatException(source + ": '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static List<String> stringList(JsonNode node, String source) {
        if (node == null || !node.isArray()) {
            throw new ModelFormatException(source + ": expected an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ModelFormatException(source + ": expected an array of strings");
            }
            values.add(item.asText());
        }
        return values;
    }
}
