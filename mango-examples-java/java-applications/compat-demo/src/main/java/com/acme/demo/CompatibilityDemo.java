package com.acme.demo;

import co.mango.core.ModelLoader;
import co.mango.core.errors.ValidationFailure;
import co.mango.core.fields.DictField;
import co.mango.core.fields.ListField;
import co.mango.core.fields.StringField;
import co.mango.core.model.Model;
import co.mango.core.model.ModelSchema;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compatibility Manifest Demo
 *
 * Declares a {@code Manifest} model describing which versions of other components a
 * release is compatible with, then walks an instance from invalid to valid:
 *
 * <ol>
 *   <li>A freshly constructed manifest: every field is still null.</li>
 *   <li>Version set, but compatibility entries map to a plain string.</li>
 *   <li>Compatibility entries fixed to lists of version strings.</li>
 * </ol>
 *
 * <h2>Running:</h2>
 * <pre>
 * cd java-applications/compat-demo
 * mvn compile exec:java -Dexec.mainClass="com.acme.demo.CompatibilityDemo"
 * </pre>
 */
public class CompatibilityDemo {

    private static final ModelSchema MANIFEST = ModelSchema.builder("Manifest")
        .field("version", new StringField())
        .field("compatibleWith", new DictField(null, new ListField(new StringField())))
        .build();

    public static void main(String[] args) {
        System.out.println();
        System.out.println("Compatibility Manifest Demo");
        System.out.println("===========================");
        System.out.println();

        try {
            Model manifest = MANIFEST.construct();
            tryValidate(manifest);

            Map<String, Object> compatibleWith = new HashMap<>();
            compatibleWith.put("key", "value");
            manifest.set("version", "1.0");
            manifest.set("compatibleWith", compatibleWith);
            tryValidate(manifest);

            compatibleWith.put("key", List.of("value1", "value2"));
            tryValidate(manifest);

            System.out.println();
            System.out.println("As JSON: " + ModelLoader.write(manifest));
            System.out.println();

        } catch (Exception e) {
            System.err.println("Error running demo: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Validate and print the outcome rather than letting the failure escape.
     */
    static boolean tryValidate(Model model) {
        System.out.print("Validation of " + model + " ");
        try {
            model.validate();
            System.out.println("succeeded");
            return true;
        } catch (ValidationFailure e) {
            System.out.println("failed: " + e.getMessage());
            return false;
        }
    }
}
