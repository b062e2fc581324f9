// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.starlark.skytest.report;

import java.io.PrintWriter;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestResult;

/**
 * Writes JUnit XML: one {@code <testsuite>} per file. File-level setup and teardown failures
 * become {@code <error>} test cases named {@code setup} and {@code teardown}.
 */
public final class JUnitReporter implements Reporter {

  @Override
  public void reportFile(PrintWriter out, FileResult result) {}

  @Override
  public void reportSummary(PrintWriter out, RunResult result) {
    try {
      XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
      xml.writeStartDocument("UTF-8", "1.0");
      newline(xml, 0);
      xml.writeStartElement("testsuites");
      xml.writeAttribute("tests", Integer.toString(result.totalCount()));
      xml.writeAttribute("failures", Integer.toString(result.failedCount()));
      xml.writeAttribute("errors", Integer.toString(countErrors(result)));
      xml.writeAttribute("time", DurationFormat.seconds(result.duration()));
      for (FileResult file : result.files()) {
        writeSuite(xml, file);
      }
      newline(xml, 0);
      xml.writeEndElement();
      xml.writeEndDocument();
      xml.flush();
      xml.close();
    } catch (XMLStreamException e) {
      throw new IllegalStateException("writing JUnit XML", e);
    }
    out.println();
    out.flush();
  }

  private static int countErrors(RunResult result) {
    int errors = 0;
    for (FileResult file : result.files()) {
      errors += fileErrors(file);
    }
    return errors;
  }

  private static int fileErrors(FileResult file) {
    return (file.setupError() != null ? 1 : 0) + (file.teardownError() != null ? 1 : 0);
  }

  private static void writeSuite(XMLStreamWriter xml, FileResult file) throws XMLStreamException {
    newline(xml, 1);
    xml.writeStartElement("testsuite");
    xml.writeAttribute("name", file.file());
    xml.writeAttribute("tests", Integer.toString(file.tests().size()));
    xml.writeAttribute("failures", Integer.toString(file.failedCount()));
    xml.writeAttribute("errors", Integer.toString(fileErrors(file)));
    xml.writeAttribute("skipped", Integer.toString(file.skippedCount()));
    xml.writeAttribute("time", DurationFormat.seconds(file.duration()));
    for (TestResult test : file.tests()) {
      newline(xml, 2);
      xml.writeStartElement("testcase");
      xml.writeAttribute("name", test.name());
      xml.writeAttribute("classname", file.file());
      xml.writeAttribute("time", DurationFormat.seconds(test.duration()));
      if (test.failed()) {
        String message =
            test.error() != null ? test.errorMessage() : "unexpected pass of xfail test";
        newline(xml, 3);
        writeProblem(xml, "failure", message, "AssertionError");
        newline(xml, 2);
      } else if (test.skipped()) {
        newline(xml, 3);
        xml.writeEmptyElement("skipped");
        xml.writeAttribute("message", test.skipReason());
        newline(xml, 2);
      }
      xml.writeEndElement();
    }
    if (file.setupError() != null) {
      writeErrorCase(xml, file, "setup", file.setupError(), "SetupError");
    }
    if (file.teardownError() != null) {
      writeErrorCase(xml, file, "teardown", file.teardownError(), "TeardownError");
    }
    newline(xml, 1);
    xml.writeEndElement();
  }

  private static void writeErrorCase(
      XMLStreamWriter xml, FileResult file, String name, Exception error, String type)
      throws XMLStreamException {
    newline(xml, 2);
    xml.writeStartElement("testcase");
    xml.writeAttribute("name", name);
    xml.writeAttribute("classname", file.file());
    xml.writeAttribute("time", "0.000");
    newline(xml, 3);
    writeProblem(xml, "error", String.valueOf(error.getMessage()), type);
    newline(xml, 2);
    xml.writeEndElement();
  }

  private static void writeProblem(XMLStreamWriter xml, String element, String message, String type)
      throws XMLStreamException {
    xml.writeStartElement(element);
    xml.writeAttribute("message", message);
    xml.writeAttribute("type", type);
    xml.writeCharacters(message);
    xml.writeEndElement();
  }

  private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException {
    xml.writeCharacters("\n" + "  ".repeat(depth));
  }
}
