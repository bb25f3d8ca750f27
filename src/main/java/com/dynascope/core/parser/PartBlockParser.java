package com.dynascope.core.parser;

import com.dynascope.core.model.PartDefinition;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the lines between two asterisk separators of the part definition
 * table into a {@link PartDefinition}.
 */
final class PartBlockParser {

    static final Pattern SEPARATOR = Pattern.compile("^\\s*\\*{60,}");

    private static final Pattern PART_ID = Pattern.compile("part\\s+id\\s*\\.+\\s*(\\d+)");
    private static final Pattern SECTION_ID = Pattern.compile("section\\s+id\\s*\\.+\\s*(\\d+)");
    private static final Pattern MATERIAL_ID = Pattern.compile("material\\s+id\\s*\\.+\\s*(\\d+)");
    private static final Pattern MATERIAL_TYPE = Pattern.compile("material type\\s*\\.+\\s*(\\d+)");
    private static final Pattern EOS_TYPE = Pattern.compile("equation-of-state type\\s*\\.+\\s*(\\d+)");
    private static final Pattern HOURGLASS_TYPE = Pattern.compile("hourglass type\\s*\\.+\\s*(\\d+)");
    private static final Pattern DENSITY = Pattern.compile("density\\s*\\.+\\s*=\\s*(\\S+)");
    private static final Pattern HOURGLASS_COEFFICIENT = Pattern.compile("hourglass coefficient\\s*\\.+\\s*=\\s*(\\S+)");
    private static final Pattern YOUNGS_MODULUS = Pattern.compile("^\\s+e\\s+\\.+\\s*=\\s*(\\S+)");
    private static final Pattern POISSON = Pattern.compile("vnu\\s*\\.+\\s*=\\s*(\\S+)");
    private static final Pattern SOLID_FORMULATION = Pattern.compile("solid\\s+formulation\\s*\\.+\\s*=\\s*(\\d+)");
    private static final Pattern SECTION_TITLE = Pattern.compile("section\\s+title\\s*\\.+");
    private static final Pattern MATERIAL_TITLE = Pattern.compile("material title\\s*\\.+");

    static final Map<Integer, String> MATERIAL_TYPE_NAMES = Map.ofEntries(
            Map.entry(1, "Elastic"),
            Map.entry(2, "Orthotropic"),
            Map.entry(3, "Elastic-Plastic (von Mises)"),
            Map.entry(5, "Soil/Crushable Foam"),
            Map.entry(6, "Viscoelastic"),
            Map.entry(7, "Blatz-Ko Rubber"),
            Map.entry(9, "Null"),
            Map.entry(20, "Rigid"),
            Map.entry(24, "Piecewise Linear Plasticity"),
            Map.entry(57, "Low Density Urethane Foam"),
            Map.entry(76, "Linear Viscoelastic"),
            Map.entry(77, "General Hyperelastic/Ogden"),
            Map.entry(98, "Simplified Johnson Cook"));

    private PartBlockParser() {}

    static String materialTypeName(int type) {
        return MATERIAL_TYPE_NAMES.getOrDefault(type, "Type " + type);
    }

    /**
     * @return the part, or {@code null} when the block carries no part id
     */
    static PartDefinition parse(List<String> lines) {
        int partId = 0;
        String name = "";
        int sectionId = 0;
        int materialId = 0;
        int materialType = 0;
        int eosType = 0;
        int hourglassType = 0;
        double hourglassCoefficient = 0.0;
        double density = 0.0;
        double youngsModulus = 0.0;
        double poissonRatio = 0.0;
        int solidFormulation = 0;
        String sectionTitle = "";
        String materialTitle = "";
        boolean expectSectionTitle = false;
        boolean expectMaterialTitle = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (expectSectionTitle) {
                sectionTitle = line.trim();
                expectSectionTitle = false;
                continue;
            }
            if (expectMaterialTitle) {
                materialTitle = line.trim();
                expectMaterialTitle = false;
                continue;
            }
            Matcher m;
            if ((m = PART_ID.matcher(line)).find()) {
                partId = Numbers.parseIntOr(m.group(1), 0);
                name = nameAbove(lines, i);
            } else if ((m = SECTION_ID.matcher(line)).find()) {
                sectionId = Numbers.parseIntOr(m.group(1), 0);
            } else if ((m = MATERIAL_ID.matcher(line)).find()) {
                materialId = Numbers.parseIntOr(m.group(1), 0);
            } else if (SECTION_TITLE.matcher(line).find()) {
                expectSectionTitle = true;
            } else if (MATERIAL_TITLE.matcher(line).find()) {
                expectMaterialTitle = true;
            } else if ((m = MATERIAL_TYPE.matcher(line)).find()) {
                materialType = Numbers.parseIntOr(m.group(1), 0);
            } else if ((m = EOS_TYPE.matcher(line)).find()) {
                eosType = Numbers.parseIntOr(m.group(1), 0);
            } else if ((m = HOURGLASS_TYPE.matcher(line)).find()) {
                hourglassType = Numbers.parseIntOr(m.group(1), 0);
            } else if ((m = HOURGLASS_COEFFICIENT.matcher(line)).find()) {
                hourglassCoefficient = Numbers.parseDoubleOr(m.group(1), 0.0);
            } else if ((m = DENSITY.matcher(line)).find()) {
                density = Numbers.parseDoubleOr(m.group(1), 0.0);
            } else if ((m = YOUNGS_MODULUS.matcher(line)).find()) {
                youngsModulus = Numbers.parseDoubleOr(m.group(1), 0.0);
            } else if ((m = POISSON.matcher(line)).find()) {
                poissonRatio = Numbers.parseDoubleOr(m.group(1), 0.0);
            } else if ((m = SOLID_FORMULATION.matcher(line)).find()) {
                solidFormulation = Numbers.parseIntOr(m.group(1), 0);
            }
        }
        if (partId == 0) {
            return null;
        }
        return new PartDefinition(partId, name, sectionId, materialId, materialType,
                materialType == 0 ? "" : materialTypeName(materialType), eosType, hourglassType,
                hourglassCoefficient, density, youngsModulus, poissonRatio, solidFormulation,
                sectionTitle, materialTitle);
    }

    /** The part title is printed on one of the three lines above "part id". */
    private static String nameAbove(List<String> lines, int index) {
        for (int j = Math.max(0, index - 3); j < index; j++) {
            String candidate = lines.get(j).trim();
            if (!candidate.isEmpty() && !candidate.startsWith("*") && !candidate.toLowerCase().contains("part")) {
                return candidate;
            }
        }
        return "";
    }
}
