package org.idfnexus.geometry.idf;

import org.idfnexus.geometry.error.MalformedIdListException;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code <idlist idname="...">} 的展开。
 * <p>
 * 支持 {@code <id start="a" end="b" step="s"/>}（包含 end）与 {@code <id val="v"/>}，按声明顺序拼接。
 */
final class IdListReader {

    private IdListReader() {
    }

    /**
     * @param document      IDF
     * @param idListName    idlist 名称（component 的 {@code idlist} 属性）
     * @param componentName 引用该 idlist 的组件名（仅用于错误信息）
     * @throws MalformedIdListException 名称为空、找不到对应 idlist 或 id 声明不合法
     */
    static List<Integer> read(IdfDocument document, String idListName, String componentName) {
        if (idListName == null) {
            throw new MalformedIdListException("组件没有声明 idlist", componentName);
        }
        for (Element idList : document.idLists()) {
            if (idListName.equals(IdfDocument.attribute(idList, "idname"))) {
                return expand(idList, componentName);
            }
        }
        throw new MalformedIdListException("找不到 idlist：" + idListName, componentName);
    }

    private static List<Integer> expand(Element idList, String componentName) {
        List<Integer> ids = new ArrayList<>();
        for (Element id : IdfDocument.children(idList, "id")) {
            String val = IdfDocument.attribute(id, "val");
            if (val != null) {
                ids.add(parse(val, componentName));
                continue;
            }
            String start = IdfDocument.attribute(id, "start");
            String end = IdfDocument.attribute(id, "end");
            if (start == null || end == null) {
                throw new MalformedIdListException("<id> 必须声明 val 或 start/end", componentName);
            }
            int from = parse(start, componentName);
            int to = parse(end, componentName);
            String stepValue = IdfDocument.attribute(id, "step");
            int step = stepValue == null ? 1 : parse(stepValue, componentName);
            if (step == 0 || ((long) to - from) * step < 0) {
                throw new MalformedIdListException("<id> 的 step 与 start/end 方向不一致：" + start + ".." + end
                        + " step " + step, componentName);
            }
            // long 计数，end 接近 int 边界时不会回绕
            if (step > 0) {
                for (long value = from; value <= to; value += step) {
                    ids.add((int) value);
                }
            } else {
                for (long value = from; value >= to; value += step) {
                    ids.add((int) value);
                }
            }
        }
        return ids;
    }

    private static int parse(String value, String componentName) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedIdListException("id 不是整数：" + value, componentName);
        }
    }
}
