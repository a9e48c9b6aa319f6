/**
 * ConstructCatalog.java
 *
 * 构造体的静态目录：展示分类表以及每种构造体声明的子节点槽位名称。
 * 分类仅用于外部展示分组，不参与树结构的构建。
 */
package club.ppmc.visualsync.engine.parser;

import club.ppmc.visualsync.model.ConstructCategory;
import java.util.Map;
import java.util.Set;

public final class ConstructCatalog {

    public static final String DEFAULT_SINGLE_CHILD_SLOT = "child";
    public static final String DEFAULT_MULTI_CHILD_SLOT = "children";

    private static final Set<String> APP = Set.of("MaterialApp", "CupertinoApp", "WidgetsApp");

    private static final Set<String> LAYOUT =
            Set.of(
                    "Container", "Row", "Column", "Stack", "Positioned", "Align", "Center",
                    "Padding", "SizedBox", "Expanded", "Flexible", "Wrap", "ListView",
                    "GridView", "CustomScrollView", "SingleChildScrollView", "Card",
                    "Scaffold", "AppBar", "Drawer", "BottomNavigationBar", "TabBar");

    private static final Set<String> INPUT =
            Set.of(
                    "TextField", "TextFormField", "Checkbox", "Radio", "Switch", "Slider",
                    "DropdownButton", "DropdownButtonFormField", "DatePicker", "TimePicker",
                    "Form", "FormField", "RawKeyboardListener", "GestureDetector",
                    "InkWell", "ElevatedButton", "TextButton", "OutlinedButton", "IconButton",
                    "FloatingActionButton");

    private static final Set<String> DISPLAY =
            Set.of(
                    "Text", "RichText", "Icon", "Image", "CircleAvatar", "Chip", "Divider",
                    "LinearProgressIndicator", "CircularProgressIndicator", "Placeholder",
                    "Spacer", "Opacity", "AnimatedOpacity", "FadeTransition");

    private static final Map<String, String> SINGLE_CHILD_SLOTS =
            Map.of(
                    "Scaffold", "body",
                    "MaterialApp", "home",
                    "CupertinoApp", "home",
                    "WidgetsApp", "home");

    private static final Map<String, String> MULTI_CHILD_SLOTS =
            Map.of("CustomScrollView", "slivers");

    private ConstructCatalog() {}

    public static ConstructCategory classify(String constructName) {
        String typeName = typeName(constructName);
        if (APP.contains(typeName)) {
            return ConstructCategory.APP;
        } else if (LAYOUT.contains(typeName)) {
            return ConstructCategory.LAYOUT;
        } else if (INPUT.contains(typeName)) {
            return ConstructCategory.INPUT;
        } else if (DISPLAY.contains(typeName)) {
            return ConstructCategory.DISPLAY;
        }
        return ConstructCategory.GENERIC;
    }

    /** 单子节点槽位名称，例如 Padding 为 "child"，Scaffold 为 "body"。 */
    public static String singleChildSlot(String constructName) {
        return SINGLE_CHILD_SLOTS.getOrDefault(typeName(constructName), DEFAULT_SINGLE_CHILD_SLOT);
    }

    /** 多子节点 (列表) 槽位名称。 */
    public static String multiChildSlot(String constructName) {
        return MULTI_CHILD_SLOTS.getOrDefault(typeName(constructName), DEFAULT_MULTI_CHILD_SLOT);
    }

    /** "EdgeInsets.all" -> "EdgeInsets"。 */
    private static String typeName(String constructName) {
        if (constructName == null) {
            return "";
        }
        int dot = constructName.indexOf('.');
        return dot < 0 ? constructName : constructName.substring(0, dot);
    }
}
