package com.ciro.ferrum.codegen;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.ImportNode;
import com.ciro.ferrum.ast.StateBindingNode;
import com.ciro.ferrum.ast.TextNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Volcado JSON del AST para depurar. Se arma con el modelo de árbol de Jackson
 * para no acoplar los records del AST a anotaciones de serialización.
 */
public final class ForestJsonWriter {

    private final ObjectMapper mapper;

    public ForestJsonWriter() {
        this(new ObjectMapper());
    }

    public ForestJsonWriter(ObjectMapper originalMapper) {
        // Copia para no tocar la configuración del mapper compartido
        this.mapper = originalMapper.copy();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(List<FrrNode> forest) {
        try {
            return mapper.writeValueAsString(toTree(forest));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Error serializando el AST a JSON", e);
        }
    }

    public ArrayNode toTree(List<FrrNode> forest) {
        ArrayNode array = mapper.createArrayNode();
        TreeBuilder builder = new TreeBuilder();
        for (FrrNode node : forest) array.add(node.accept(builder));
        return array;
    }

    private final class TreeBuilder implements FrrNode.Visitor<ObjectNode> {

        @Override
        public ObjectNode visitElement(ElementNode element) {
            ObjectNode json = kind("element");
            json.put("tag", element.tag());
            json.set("attributes", attributes(element.attributes()));
            json.set("children", children(element.children()));
            return json;
        }

        @Override
        public ObjectNode visitText(TextNode text) {
            return kind("text").put("text", text.text());
        }

        @Override
        public ObjectNode visitComponent(ComponentNode component) {
            ObjectNode json = kind("component");
            json.put("name", component.name());
            json.set("attributes", attributes(component.attributes()));
            json.set("children", children(component.children()));
            return json;
        }

        @Override
        public ObjectNode visitStateBinding(StateBindingNode binding) {
            return kind("stateBinding")
                    .put("signal", binding.signal())
                    .put("member", binding.member());
        }

        @Override
        public ObjectNode visitImport(ImportNode importNode) {
            ObjectNode json = kind("import");
            ArrayNode names = json.putArray("names");
            importNode.names().forEach(names::add);
            json.put("source", importNode.source());
            return json;
        }

        private ObjectNode kind(String kind) {
            return mapper.createObjectNode().put("kind", kind);
        }

        private ObjectNode attributes(Map<String, String> attributes) {
            ObjectNode json = mapper.createObjectNode();
            attributes.forEach(json::put);
            return json;
        }

        private ArrayNode children(List<FrrNode> children) {
            ArrayNode array = mapper.createArrayNode();
            for (FrrNode child : children) array.add(child.accept(this));
            return array;
        }
    }
}
