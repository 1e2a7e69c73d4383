package com.campusevents.checkin.report;

/**
 * レポートを 1 形式のバイト列へ変換する。
 *
 * <p>実装は UTF-8 で出力し、同じレポートから常に同じバイト列を返す。行の並べ替えや絞り込みはしない。
 */
public interface ReportEncoder {

  ReportFormat format();

  byte[] encode(AttendanceReport report);
}
