package dev.modelkit.registry;

import dev.modelkit.config.ModelKitConfig;
import java.util.Objects;

/**
 * Derives the model type of a model class from its package: for a class in {@code
 * <transformersPackage>.<type>...} the type is the first segment after the root, e.g. {@code
 * RobertaForTokenClassification} in {@code dev.modelkit.transformers.roberta} is {@code roberta}.
 */
public final class ModelTypes {
    /** Returned for classes that are not models or live outside the transformers package. */
    public static final String UNKNOWN = "";

    private final Class<?> modelBaseType;
    private final String transformersPackage;

    public ModelTypes(Class<?> modelBaseType, String transformersPackage) {
        this.modelBaseType = Objects.requireNonNull(modelBaseType);
        this.transformersPackage = Objects.requireNonNull(transformersPackage);
    }

    public static ModelTypes fromConfig(Class<?> modelBaseType, ModelKitConfig config) {
        return new ModelTypes(modelBaseType, config.transformersPackage());
    }

    public String findModelType(Class<?> modelClass) {
        if (!modelBaseType.isAssignableFrom(modelClass)) {
            return UNKNOWN;
        }
        String prefix = transformersPackage + ".";
        String packageName = modelClass.getPackageName();
        if (!packageName.startsWith(prefix)) {
            return UNKNOWN;
        }
        String rest = packageName.substring(prefix.length());
        int dot = rest.indexOf('.');
        return dot < 0 ? rest : rest.substring(0, dot);
    }
}
