package com.sidr.mapping;

import lombok.experimental.UtilityClass;

import java.util.List;

import static com.sidr.mapping.FieldMapping.of;
import static com.sidr.mapping.ValueTransform.FILETIME;
import static com.sidr.mapping.ValueTransform.INTEGER;
import static com.sidr.mapping.ValueTransform.TEXT;

/**
 * Column-to-field mappings of the Windows Search property store tables.
 * <p>
 * Column names are the normalized property names; ESE stores prefix them with a numeric
 * property id ({@code 4447-System_ItemPathDisplay}). Supporting another source table is a
 * matter of adding a {@link TableMapping} here.
 */
@UtilityClass
public final class WindowsSearchMappings {

    public static final String ESE_PROPERTY_STORE = "SystemIndex_PropertyStore";
    public static final String ESE_LEGACY_PROPERTY_STORE = "SystemIndex_0A";
    public static final String SQLITE_PROPERTY_STORE = "SystemIndex_1_PropertyStore";

    static final String STORE_COLUMN = "System_Search_Store";
    static final String ITEM_TYPE_COLUMN = "System_ItemType";

    static final List<FieldMapping> FILE_FIELDS = List.of(
            of("WorkID", "WorkId", INTEGER),
            of(ArtifactMapper.HOSTNAME_COLUMN, "ComputerName", TEXT),
            of("System_ItemPathDisplay", "FullPath", TEXT),
            of("System_ItemNameDisplay", "FileName", TEXT),
            of("System_FileExtension", "FileExtension", TEXT),
            of("System_ItemTypeText", "ItemTypeText", TEXT),
            of("System_Size", "Size", INTEGER),
            of("System_FileAttributes", "FileAttributes", INTEGER),
            of("System_FileOwner", "Owner", TEXT),
            of("System_DateCreated", "DateCreated", FILETIME),
            of("System_DateModified", "DateModified", FILETIME),
            of("System_DateAccessed", "DateAccessed", FILETIME),
            of("System_Search_GatherTime", "GatherTime", FILETIME),
            of("System_Search_AutoSummary", "AutoSummary", TEXT));

    static final List<FieldMapping> INTERNET_FIELDS = List.of(
            of("WorkID", "WorkId", INTEGER),
            of(ArtifactMapper.HOSTNAME_COLUMN, "ComputerName", TEXT),
            of("System_ItemName", "ItemName", TEXT),
            of("System_ItemUrl", "URL", TEXT),
            of("System_Link_TargetUrl", "TargetURL", TEXT),
            of("System_Title", "Title", TEXT),
            of("System_ItemDate", "ItemDate", FILETIME),
            of("System_Link_DateVisited", "DateVisited", FILETIME),
            of("System_Search_GatherTime", "GatherTime", FILETIME));

    static final List<FieldMapping> ACTIVITY_FIELDS = List.of(
            of("WorkID", "WorkId", INTEGER),
            of(ArtifactMapper.HOSTNAME_COLUMN, "ComputerName", TEXT),
            of("System_ItemNameDisplay", "FileName", TEXT),
            of("System_ItemPathDisplay", "FullPath", TEXT),
            of("System_Activity_AppDisplayName", "AppName", TEXT),
            of("System_ActivityHistory_AppId", "AppId", TEXT),
            of("System_Activity_DisplayText", "DisplayText", TEXT),
            of("System_Activity_ContentUri", "ContentUri", TEXT),
            of("System_ActivityHistory_StartTime", "StartTime", FILETIME),
            of("System_ActivityHistory_EndTime", "EndTime", FILETIME),
            of("System_ActivityHistory_ActiveDuration", "ActiveDuration", INTEGER),
            of("System_Search_GatherTime", "GatherTime", FILETIME));

    static final List<MappingRule> RULES = List.of(
            new MappingRule(ReportKind.ACTIVITY_HISTORY,
                    RowPredicate.columnEquals(ITEM_TYPE_COLUMN, "ActivityHistoryItem"), ACTIVITY_FIELDS),
            new MappingRule(ReportKind.INTERNET_HISTORY,
                    RowPredicate.columnEquals(STORE_COLUMN, "iehistory"), INTERNET_FIELDS),
            new MappingRule(ReportKind.FILE,
                    RowPredicate.columnEquals(STORE_COLUMN, "file"), FILE_FIELDS));

    /**
     * Mapper for {@code Windows.edb}.
     */
    public static ArtifactMapper ese() {
        return new ArtifactMapper(List.of(
                new TableMapping(ESE_PROPERTY_STORE, RULES),
                new TableMapping(ESE_LEGACY_PROPERTY_STORE, RULES)));
    }

    /**
     * Mapper for {@code Windows.db}, whose property store is pivoted into one row per work id.
     */
    public static ArtifactMapper sqlite() {
        return new ArtifactMapper(List.of(new TableMapping(SQLITE_PROPERTY_STORE, RULES)));
    }
}
