package com.myorg.normcontrol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.StampInfo;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.patterns.PatternLibraryLoader;

/**
 * Shared test data.
 */
public final class Fixtures {

    private static final PatternLibrary DEFAULT_LIBRARY =
            new PatternLibraryLoader(new ObjectMapper()).load(PatternLibraryLoader.DEFAULT_LOCATION);

    private Fixtures() {
    }

    public static PatternLibrary defaultLibrary() {
        return DEFAULT_LIBRARY;
    }

    public static Page page(int number, PageRole role, String text) {
        return Page.builder()
                .pageNumber(number)
                .rawText(text)
                .classifiedRole(role)
                .confidence(0.75)
                .build();
    }

    public static Page drawing(int number, String text, StampInfo stamp) {
        return page(number, PageRole.DRAWING, text).toBuilder().stamp(stamp).build();
    }

    public static StampInfo stampWithSheet(Integer sheetNumber) {
        return StampInfo.builder().hasStamp(true).sheetNumber(sheetNumber).scale("1:100").build();
    }

    // five pages: title, general data, drawing with stamp, specification, drawing without stamp
    public static final String TITLE_PAGE = String.join("\n",
            "ООО «Проектный институт»",
            "Комбинат по переработке руды",
            "Рабочая документация",
            "Шифр 2024-01-15-КЖ",
            "Стадия Р");

    public static final String GENERAL_DATA_PAGE = String.join("\n",
            "Общие данные",
            "Ведомость рабочих чертежей основного комплекта",
            "Ведомость ссылочных и прилагаемых документов",
            "Общие указания",
            "Шифр 2024-01-15-КЖ",
            "Масштаб 1:100",
            "Бетон класса B25 по СП 63.13330.2018");

    public static final String STAMPED_DRAWING_PAGE = String.join("\n",
            "План на отм. 0.000",
            "Фундамент Фм1, размеры 1200 мм",
            "Изм. Подп. Дата",
            "Лист 3",
            "Листов 5",
            "М 1:100");

    public static final String SPECIFICATION_PAGE = String.join("\n",
            "Спецификация элементов",
            "Поз. Обозначение Наименование Кол.",
            "1 ГОСТ 5781-82 Арматура класса А500С");

    public static final String UNSTAMPED_DRAWING_PAGE = String.join("\n",
            "Разрез 1-1",
            "Схема армирования, размеры 300 мм");
}
